/*
 * TransformSubstitution.java
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

package com.apple.foundationdb.rewrite.rules;

import com.apple.foundationdb.rewrite.UnboundPlaceholderException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.ExpressionKind;
import com.apple.foundationdb.rewrite.expressions.ExpressionVisitor;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.apple.foundationdb.rewrite.matching.PlaceholderBindings;

import javax.annotation.Nonnull;

/**
 * Instantiates the output template of a transform against the bindings of a match.
 *
 * <ul>
 *     <li>An addition is rebuilt from its instantiated children.</li>
 *     <li>A placeholder leaf is replaced by a new leaf holding the value of the query node bound to its name.</li>
 *     <li>A concrete leaf is copied.</li>
 * </ul>
 *
 * <p>
 * Binding names are not carried over, and the result shares no node with the template or the query.
 * </p>
 */
@API(API.Status.INTERNAL)
public class TransformSubstitution implements ExpressionVisitor<Expression> {
    @Nonnull
    private final PlaceholderBindings bindings;

    private TransformSubstitution(@Nonnull PlaceholderBindings bindings) {
        this.bindings = bindings;
    }

    /**
     * Instantiate a template.
     * @param template the output template
     * @param bindings the bindings of the input pattern to the matched query
     * @return a new tree
     * @throws UnboundPlaceholderException if a placeholder of {@code template} is not bound to a numeric leaf
     */
    @Nonnull
    public static Expression instantiate(@Nonnull Expression template, @Nonnull PlaceholderBindings bindings) {
        return template.accept(new TransformSubstitution(bindings));
    }

    @Override
    public Expression visitNumericConstant(@Nonnull NumericConstantExpression numericConstant) {
        if (!numericConstant.isWildcard()) {
            return new NumericConstantExpression(numericConstant.getNumeric());
        }
        final Expression bound = bindings.lookup(numericConstant.getBindingName());
        if (bound.getKind() != ExpressionKind.NUMERIC_CONSTANT) {
            throw new UnboundPlaceholderException("placeholder is bound to a node that is not a numeric constant",
                    LogMessageKeys.BINDING_NAME, numericConstant.getBindingName(),
                    LogMessageKeys.EXPRESSION, bound);
        }
        return new NumericConstantExpression(((NumericConstantExpression)bound).getNumeric());
    }

    @Override
    public Expression visitBinaryAddition(@Nonnull BinaryAdditionExpression binaryAddition) {
        return new BinaryAdditionExpression(binaryAddition.getLeft().accept(this), binaryAddition.getRight().accept(this));
    }
}
