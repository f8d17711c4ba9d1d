/*
 * ExpressionFlattener.java
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

package com.apple.foundationdb.rewrite.matching;

import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.ExpressionVisitor;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.Function;

/**
 * Flattens trees into lists using a post-order traversal: left subtree, right subtree, then the node itself.
 * Two trees of the same shape flatten to lists of the same length in which equal indexes denote equal positions.
 */
@API(API.Status.INTERNAL)
public class ExpressionFlattener<T> implements ExpressionVisitor<Void> {
    @Nonnull
    private final Function<Expression, T> extractor;
    @Nonnull
    private final ImmutableList.Builder<T> builder = ImmutableList.builder();

    private ExpressionFlattener(@Nonnull Function<Expression, T> extractor) {
        this.extractor = extractor;
    }

    /**
     * Flatten the nodes of a tree. The returned list references the nodes of {@code root}; it does not own them.
     * @param root the root of the tree
     * @return the nodes of the tree in post-order
     */
    @Nonnull
    public static List<Expression> flattenExpressions(@Nonnull Expression root) {
        return flatten(root, Function.identity());
    }

    /**
     * Flatten the binding names of a tree. Unbound nodes contribute {@link Expression#UNBOUND}.
     * @param root the root of the tree
     * @return the binding names of the tree's nodes in post-order
     */
    @Nonnull
    public static List<String> flattenBindingNames(@Nonnull Expression root) {
        return flatten(root, Expression::getBindingName);
    }

    @Nonnull
    private static <T> List<T> flatten(@Nonnull Expression root, @Nonnull Function<Expression, T> extractor) {
        final ExpressionFlattener<T> flattener = new ExpressionFlattener<>(extractor);
        root.accept(flattener);
        return flattener.builder.build();
    }

    @Override
    public Void visitNumericConstant(@Nonnull NumericConstantExpression numericConstant) {
        builder.add(extractor.apply(numericConstant));
        return null;
    }

    @Override
    public Void visitBinaryAddition(@Nonnull BinaryAdditionExpression binaryAddition) {
        binaryAddition.getLeft().accept(this);
        binaryAddition.getRight().accept(this);
        builder.add(extractor.apply(binaryAddition));
        return null;
    }
}
