/*
 * Expression.java
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

package com.apple.foundationdb.rewrite.expressions;

import com.apple.foundationdb.rewrite.WildcardEvaluationException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.evaluation.ExpressionEvaluator;

import javax.annotation.Nonnull;

/**
 * A node of an arithmetic expression tree.
 *
 * <p>
 * An expression is either a {@link NumericConstantExpression} or a {@link BinaryAdditionExpression}; no other kind
 * of node exists. Every node may carry a binding name, which is only meaningful inside transform patterns where it
 * ties a pattern position to the node it matched. The empty string means "not bound".
 * </p>
 *
 * <p>
 * A parent owns its children exclusively. A node can be the child of at most one addition at a time, so
 * expressions always form trees, never graphs. Use {@link #copy()} to reuse a subtree somewhere else.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class Expression {
    /**
     * Binding name of nodes that are not bound.
     */
    @Nonnull
    public static final String UNBOUND = "";

    @Nonnull
    private final ExpressionKind kind;
    @Nonnull
    private final String bindingName;
    private boolean attached;

    Expression(@Nonnull ExpressionKind kind, @Nonnull String bindingName) {
        this.kind = kind;
        this.bindingName = bindingName;
    }

    @Nonnull
    public ExpressionKind getKind() {
        return kind;
    }

    @Nonnull
    public String getBindingName() {
        return bindingName;
    }

    public boolean hasBindingName() {
        return !bindingName.isEmpty();
    }

    /**
     * Evaluate this tree.
     * @return the sum of all numeric constants of the tree
     * @throws WildcardEvaluationException if the tree contains an "any number" placeholder
     */
    public long evaluate() {
        return ExpressionEvaluator.evaluate(this);
    }

    /**
     * Create a deep copy of this tree. The copy keeps all binding names and shares no node with this tree.
     * @return the copy
     */
    @Nonnull
    public abstract Expression copy();

    public abstract <T> T accept(@Nonnull ExpressionVisitor<T> visitor);

    /**
     * Whether this node is currently the child of some addition.
     * @return {@code true} if the node is owned by a parent
     */
    public boolean isAttached() {
        return attached;
    }

    void attach() {
        attached = true;
    }

    void detach() {
        attached = false;
    }

    /**
     * Whether {@code node} is this node or one of its descendants, by identity.
     * @param node the node to look for
     * @return {@code true} if this tree contains {@code node}
     */
    abstract boolean containsNode(@Nonnull Expression node);

    @Nonnull
    String bindingSuffix() {
        return hasBindingName() ? ":" + bindingName : "";
    }
}
