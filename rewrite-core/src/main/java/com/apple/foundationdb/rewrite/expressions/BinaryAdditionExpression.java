/*
 * BinaryAdditionExpression.java
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

import com.apple.foundationdb.rewrite.RewriteCoreArgumentException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The sum of two subexpressions, e.g. {@code 1 + 2}. The node owns both of its children.
 */
@API(API.Status.STABLE)
public final class BinaryAdditionExpression extends Expression {
    @Nonnull
    private Expression left;
    @Nonnull
    private Expression right;

    public BinaryAdditionExpression(@Nonnull Expression left, @Nonnull Expression right) {
        this(left, right, UNBOUND);
    }

    public BinaryAdditionExpression(@Nonnull Expression left, @Nonnull Expression right, @Nonnull String bindingName) {
        super(ExpressionKind.BINARY_ADDITION, bindingName);
        if (left == right) {
            throw new RewriteCoreArgumentException("the same node cannot be both children of an addition",
                    LogMessageKeys.CHILD, left);
        }
        // a node under construction cannot be inside its children, so only ownership is checked here
        checkNotOwned(left);
        checkNotOwned(right);
        this.left = left;
        this.right = right;
        left.attach();
        right.attach();
    }

    @Nonnull
    public Expression getLeft() {
        return left;
    }

    @Nonnull
    public Expression getRight() {
        return right;
    }

    /**
     * Replace the left subtree.
     * @param newLeft the new left subtree, which must not be owned by another node
     * @return the previous left subtree, now detached from this node
     */
    @Nonnull
    public Expression replaceLeft(@Nonnull Expression newLeft) {
        final Expression previous = left;
        if (newLeft == previous) {
            return previous;
        }
        checkNotOwned(newLeft);
        checkNotCyclic(newLeft);
        previous.detach();
        left = newLeft;
        newLeft.attach();
        return previous;
    }

    /**
     * Replace the right subtree.
     * @param newRight the new right subtree, which must not be owned by another node
     * @return the previous right subtree, now detached from this node
     */
    @Nonnull
    public Expression replaceRight(@Nonnull Expression newRight) {
        final Expression previous = right;
        if (newRight == previous) {
            return previous;
        }
        checkNotOwned(newRight);
        checkNotCyclic(newRight);
        previous.detach();
        right = newRight;
        newRight.attach();
        return previous;
    }

    private static void checkNotOwned(@Nonnull Expression child) {
        if (child.isAttached()) {
            throw new RewriteCoreArgumentException("child is already owned by another addition",
                    LogMessageKeys.CHILD, child);
        }
    }

    private void checkNotCyclic(@Nonnull Expression child) {
        if (child.containsNode(this)) {
            throw new RewriteCoreArgumentException("child would make the tree cyclic",
                    LogMessageKeys.CHILD, child);
        }
    }

    @Nonnull
    @Override
    public BinaryAdditionExpression copy() {
        return new BinaryAdditionExpression(left.copy(), right.copy(), getBindingName());
    }

    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitBinaryAddition(this);
    }

    @Override
    boolean containsNode(@Nonnull Expression node) {
        return this == node || left.containsNode(node) || right.containsNode(node);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final BinaryAdditionExpression that = (BinaryAdditionExpression)o;
        return getBindingName().equals(that.getBindingName()) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), left, right, getBindingName());
    }

    @Override
    public String toString() {
        return "(" + left + " + " + right + ")" + bindingSuffix();
    }
}
