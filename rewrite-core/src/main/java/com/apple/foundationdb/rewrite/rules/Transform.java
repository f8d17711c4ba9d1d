/*
 * Transform.java
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

import com.apple.foundationdb.rewrite.InvalidTransformException;
import com.apple.foundationdb.rewrite.RewriteCoreArgumentException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.ExpressionKind;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.apple.foundationdb.rewrite.matching.ExpressionFlattener;
import com.apple.foundationdb.rewrite.matching.ExpressionMatcher;
import com.apple.foundationdb.rewrite.matching.PlaceholderBindings;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A single rewrite rule: a name, an input pattern and an output template.
 *
 * <p>
 * A query subtree matching the input pattern (see {@link ExpressionMatcher}) is rewritten into a fresh instance of the
 * output template, in which each placeholder takes the value of the query leaf that the input pattern bound under
 * the same name. For example, the input pattern {@code 0 + any:right} with the template {@code any:right} rewrites
 * {@code 0 + 7} into {@code 7}.
 * </p>
 *
 * <p>
 * Transforms are immutable. The following is checked when one is created:
 * </p>
 * <ul>
 *     <li>binding names are unique within the input pattern;</li>
 *     <li>every placeholder of the output template has a binding name that the input pattern binds to a numeric
 *     leaf.</li>
 * </ul>
 */
@API(API.Status.STABLE)
public class Transform {
    @Nonnull
    private final String name;
    @Nonnull
    private final Expression inputPattern;
    @Nonnull
    private final Expression outputPattern;

    /**
     * Create a new transform. Both patterns are copied.
     * @param name human-readable name of the transform
     * @param inputPattern the pattern to look for
     * @param outputPattern the template that replaces each match
     * @throws InvalidTransformException if the patterns break the rules listed above
     */
    public Transform(@Nonnull String name, @Nonnull Expression inputPattern, @Nonnull Expression outputPattern) {
        if (name.isEmpty()) {
            throw new InvalidTransformException("transform name must not be empty",
                    LogMessageKeys.INPUT_PATTERN, inputPattern);
        }
        this.name = name;
        this.inputPattern = inputPattern.copy();
        this.outputPattern = outputPattern.copy();
        validate();
    }

    private void validate() {
        final Map<String, Expression> boundNodes = new HashMap<>();
        for (Expression node : ExpressionFlattener.flattenExpressions(inputPattern)) {
            if (node.hasBindingName() && boundNodes.put(node.getBindingName(), node) != null) {
                throw new InvalidTransformException("binding name used more than once in input pattern",
                        LogMessageKeys.TRANSFORM_NAME, name,
                        LogMessageKeys.BINDING_NAME, node.getBindingName(),
                        LogMessageKeys.INPUT_PATTERN, inputPattern);
            }
        }
        for (Expression node : ExpressionFlattener.flattenExpressions(outputPattern)) {
            if (node.getKind() != ExpressionKind.NUMERIC_CONSTANT || !((NumericConstantExpression)node).isWildcard()) {
                continue;
            }
            final Expression bound = boundNodes.get(node.getBindingName());
            if (bound == null) {
                throw new InvalidTransformException("output placeholder is not bound by input pattern",
                        LogMessageKeys.TRANSFORM_NAME, name,
                        LogMessageKeys.BINDING_NAME, node.getBindingName(),
                        LogMessageKeys.INPUT_PATTERN, inputPattern,
                        LogMessageKeys.OUTPUT_PATTERN, outputPattern);
            }
            if (bound.getKind() != ExpressionKind.NUMERIC_CONSTANT) {
                throw new InvalidTransformException("output placeholder must be bound to a numeric constant",
                        LogMessageKeys.TRANSFORM_NAME, name,
                        LogMessageKeys.BINDING_NAME, node.getBindingName(),
                        LogMessageKeys.EXPRESSION_KIND, bound.getKind());
            }
        }
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Get the input pattern.
     * @return a copy of the input pattern
     */
    @Nonnull
    public Expression getInputPattern() {
        return inputPattern.copy();
    }

    /**
     * Get the output template.
     * @return a copy of the output template
     */
    @Nonnull
    public Expression getOutputPattern() {
        return outputPattern.copy();
    }

    /**
     * Get the binding names of the input pattern in post-order.
     * @return the binding names, with {@link Expression#UNBOUND} for unbound nodes
     */
    @Nonnull
    public List<String> getBindingNames() {
        return ExpressionFlattener.flattenBindingNames(inputPattern);
    }

    /**
     * Check whether this transform applies at the root of {@code query}.
     * @param query the subtree to test
     * @return {@code true} if the input pattern matches {@code query}
     */
    public boolean matches(@Nonnull Expression query) {
        return ExpressionMatcher.matches(inputPattern, query);
    }

    /**
     * Rewrite a subtree matched by the input pattern.
     * @param matched a subtree for which {@link #matches(Expression)} holds
     * @return a new tree instantiated from the output template
     * @throws RewriteCoreArgumentException if the input pattern does not match {@code matched}
     */
    @Nonnull
    public Expression rewrite(@Nonnull Expression matched) {
        if (!matches(matched)) {
            throw new RewriteCoreArgumentException("transform does not match expression",
                    LogMessageKeys.TRANSFORM_NAME, name,
                    LogMessageKeys.EXPRESSION, matched);
        }
        return TransformSubstitution.instantiate(outputPattern, PlaceholderBindings.bind(inputPattern, matched));
    }

    @Override
    public String toString() {
        return name + ": " + inputPattern + " -> " + outputPattern;
    }
}
