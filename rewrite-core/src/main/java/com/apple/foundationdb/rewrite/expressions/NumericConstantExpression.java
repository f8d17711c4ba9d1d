/*
 * NumericConstantExpression.java
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
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A numeric leaf. Holds either a concrete value or, in transform patterns, the {@link Numeric#ANY} placeholder.
 */
@API(API.Status.STABLE)
public final class NumericConstantExpression extends Expression {
    @Nonnull
    private final Numeric numeric;

    public NumericConstantExpression(@Nonnull Numeric numeric) {
        this(numeric, UNBOUND);
    }

    public NumericConstantExpression(@Nonnull Numeric numeric, @Nonnull String bindingName) {
        super(ExpressionKind.NUMERIC_CONSTANT, bindingName);
        this.numeric = numeric;
    }

    @Nonnull
    public Numeric getNumeric() {
        return numeric;
    }

    public boolean isWildcard() {
        return numeric.isWildcard();
    }

    /**
     * Get the concrete value of this leaf.
     * @return the value
     * @throws WildcardEvaluationException if this leaf is a placeholder
     */
    public long getValue() {
        if (isWildcard()) {
            throw new WildcardEvaluationException("attempted to evaluate an \"any number\" placeholder",
                    LogMessageKeys.BINDING_NAME, getBindingName());
        }
        return numeric.getValue();
    }

    @Nonnull
    @Override
    public NumericConstantExpression copy() {
        return new NumericConstantExpression(numeric, getBindingName());
    }

    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitNumericConstant(this);
    }

    @Override
    boolean containsNode(@Nonnull Expression node) {
        return this == node;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final NumericConstantExpression that = (NumericConstantExpression)o;
        return numeric.equals(that.numeric) && getBindingName().equals(that.getBindingName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), numeric, getBindingName());
    }

    @Override
    public String toString() {
        return numeric + bindingSuffix();
    }
}
