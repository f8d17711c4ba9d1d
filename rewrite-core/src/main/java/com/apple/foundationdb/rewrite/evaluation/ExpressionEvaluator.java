/*
 * ExpressionEvaluator.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.rewrite.evaluation;

import com.apple.foundationdb.rewrite.WildcardEvaluationException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.ExpressionVisitor;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;

import javax.annotation.Nonnull;

/**
 * Evaluates concrete expression trees. Overflow is not checked.
 */
@API(API.Status.STABLE)
public class ExpressionEvaluator implements ExpressionVisitor<Long> {
    private static final ExpressionEvaluator INSTANCE = new ExpressionEvaluator();

    private ExpressionEvaluator() {
    }

    /**
     * Evaluate an expression.
     * @param root the root of the expression
     * @return the result of evaluating the expression
     * @throws WildcardEvaluationException if the tree contains an "any number" placeholder
     */
    public static long evaluate(@Nonnull Expression root) {
        return root.accept(INSTANCE);
    }

    @Override
    public Long visitNumericConstant(@Nonnull NumericConstantExpression numericConstant) {
        return numericConstant.getValue();
    }

    @Override
    public Long visitBinaryAddition(@Nonnull BinaryAdditionExpression binaryAddition) {
        return binaryAddition.getLeft().accept(this) + binaryAddition.getRight().accept(this);
    }
}
