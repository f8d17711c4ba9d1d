/*
 * PlaceholderBindings.java
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

import com.apple.foundationdb.rewrite.RewriteCoreException;
import com.apple.foundationdb.rewrite.UnboundPlaceholderException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The correspondence between the binding names of a pattern and the nodes of a query the pattern matched.
 *
 * <p>
 * There is no explicit map from names to nodes. Both trees are flattened in post-order and, because a successful
 * match guarantees that they have the same shape, the i-th binding name of the pattern belongs to the i-th node of
 * the query. Looking a name up means finding its first index in the pattern's names and reading the query node at
 * that index. This is only well defined if binding names are unique within the pattern, which
 * {@link com.apple.foundationdb.rewrite.rules.Transform} checks when a transform is created.
 * </p>
 *
 * <p>
 * The bindings reference nodes of the query without owning them and are only meant to live for one substitution.
 * </p>
 */
@API(API.Status.INTERNAL)
public class PlaceholderBindings {
    @Nonnull
    private final List<String> bindingNames;
    @Nonnull
    private final List<Expression> expressions;

    private PlaceholderBindings(@Nonnull List<String> bindingNames, @Nonnull List<Expression> expressions) {
        this.bindingNames = bindingNames;
        this.expressions = expressions;
    }

    /**
     * Bind the names of {@code pattern} to the nodes of {@code query}.
     * @param pattern a pattern that matches {@code query}
     * @param query the matched subtree
     * @return the bindings
     * @throws RewriteCoreException if the two trees do not have the same number of nodes
     */
    @Nonnull
    public static PlaceholderBindings bind(@Nonnull Expression pattern, @Nonnull Expression query) {
        final List<String> bindingNames = ExpressionFlattener.flattenBindingNames(pattern);
        final List<Expression> expressions = ExpressionFlattener.flattenExpressions(query);
        if (bindingNames.size() != expressions.size()) {
            throw new RewriteCoreException("pattern and query do not have the same shape",
                    LogMessageKeys.INPUT_PATTERN, pattern,
                    LogMessageKeys.EXPRESSION, query);
        }
        return new PlaceholderBindings(bindingNames, expressions);
    }

    /**
     * Get the query node bound to a name.
     * @param bindingName the binding name of a pattern node
     * @return the query node at the same position as the first pattern node carrying {@code bindingName}
     * @throws UnboundPlaceholderException if the name is empty or not used by the pattern
     */
    @Nonnull
    public Expression lookup(@Nonnull String bindingName) {
        final int index = bindingName.isEmpty() ? -1 : bindingNames.indexOf(bindingName);
        if (index < 0) {
            throw new UnboundPlaceholderException("placeholder is not bound by the input pattern",
                    LogMessageKeys.BINDING_NAME, bindingName,
                    LogMessageKeys.BINDING_NAMES, bindingNames);
        }
        return expressions.get(index);
    }

    /**
     * Get the binding names of the pattern in post-order.
     * @return the binding names, including {@link Expression#UNBOUND} for unbound nodes
     */
    @Nonnull
    public List<String> getBindingNames() {
        return bindingNames;
    }

    /**
     * Get the nodes of the query in post-order.
     * @return the nodes
     */
    @Nonnull
    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public String toString() {
        final ImmutableList.Builder<String> pairs = ImmutableList.builder();
        for (int i = 0; i < bindingNames.size(); i++) {
            if (!bindingNames.get(i).isEmpty()) {
                pairs.add(bindingNames.get(i) + "=" + expressions.get(i));
            }
        }
        return pairs.build().toString();
    }
}
