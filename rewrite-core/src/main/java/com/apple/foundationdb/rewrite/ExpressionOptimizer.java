/*
 * ExpressionOptimizer.java
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

package com.apple.foundationdb.rewrite;

import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.ExpressionVisitor;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;
import com.apple.foundationdb.rewrite.logging.KeyValueLogMessage;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.apple.foundationdb.rewrite.matching.ExpressionMatcher;
import com.apple.foundationdb.rewrite.rules.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * A simple, tree-style expression optimizer.
 *
 * <p>
 * The optimizer applies each transform of its rule set once, in order. Applying a transform is a single top-down
 * pass over the current tree: where the transform's input pattern matches, the whole subtree is replaced by the
 * instantiated output and the pass does not look inside it again; elsewhere the pass descends into the children.
 * The result of one pass is the input of the next transform. There is no iteration to a fixpoint, so a rewrite
 * opportunity created by a transform is only taken by a transform that runs after it.
 * </p>
 *
 * <p>
 * The input tree is never modified. The returned tree is always a new, independently owned tree.
 * </p>
 */
@API(API.Status.STABLE)
public class ExpressionOptimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionOptimizer.class);

    @Nonnull
    private final OptimizerConfiguration configuration;

    public ExpressionOptimizer() {
        this(OptimizerConfiguration.defaultConfiguration());
    }

    public ExpressionOptimizer(@Nonnull OptimizerConfiguration configuration) {
        this.configuration = configuration;
    }

    @Nonnull
    public OptimizerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Optimize an expression tree.
     * @param root the root of the tree, which must not contain placeholders
     * @return the optimized tree
     */
    @Nonnull
    public Expression optimize(@Nonnull Expression root) {
        Expression current = root;
        for (Transform transform : configuration.getRuleSet().getTransforms()) {
            if (!configuration.isTransformEnabled(transform)) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("skipping disabled transform",
                            LogMessageKeys.TRANSFORM_NAME, transform.getName()));
                }
                continue;
            }
            final TransformPass pass = new TransformPass(transform);
            final Expression transformed = current.accept(pass);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("applied transform",
                        LogMessageKeys.TRANSFORM_NAME, transform.getName(),
                        LogMessageKeys.REWRITE_COUNT, pass.getRewriteCount(),
                        LogMessageKeys.BEFORE, current,
                        LogMessageKeys.AFTER, transformed));
            }
            current = transformed;
        }
        return current == root ? root.copy() : current;
    }

    /**
     * Apply a single transform to a whole tree in one pass.
     * @param transform the transform to apply
     * @param root the root of the tree
     * @return a new tree in which every outermost match of the transform has been rewritten
     */
    @Nonnull
    public static Expression applyTransform(@Nonnull Transform transform, @Nonnull Expression root) {
        return root.accept(new TransformPass(transform));
    }

    /**
     * Match a pattern against a query.
     * @param pattern the pattern tree
     * @param query the query tree
     * @return {@code true} if {@code pattern} matches {@code query}
     * @see ExpressionMatcher#matches(Expression, Expression)
     */
    public static boolean matches(@Nonnull Expression pattern, @Nonnull Expression query) {
        return ExpressionMatcher.matches(pattern, query);
    }

    /**
     * One pass of one transform. Rebuilds the tree top-down, replacing each outermost match.
     */
    private static class TransformPass implements ExpressionVisitor<Expression> {
        @Nonnull
        private final Transform transform;
        private int rewriteCount;

        TransformPass(@Nonnull Transform transform) {
            this.transform = transform;
        }

        int getRewriteCount() {
            return rewriteCount;
        }

        @Nonnull
        private Expression rewrite(@Nonnull Expression matched) {
            rewriteCount++;
            return transform.rewrite(matched);
        }

        @Override
        public Expression visitNumericConstant(@Nonnull NumericConstantExpression numericConstant) {
            if (transform.matches(numericConstant)) {
                return rewrite(numericConstant);
            }
            return numericConstant.copy();
        }

        @Override
        public Expression visitBinaryAddition(@Nonnull BinaryAdditionExpression binaryAddition) {
            if (transform.matches(binaryAddition)) {
                return rewrite(binaryAddition);
            }
            return new BinaryAdditionExpression(
                    binaryAddition.getLeft().accept(this),
                    binaryAddition.getRight().accept(this),
                    binaryAddition.getBindingName());
        }
    }
}
