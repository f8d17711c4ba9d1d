/*
 * Numeric.java
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
import com.apple.foundationdb.rewrite.WildcardEvaluationException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The payload of a {@link NumericConstantExpression}: either a concrete unsigned integer or the {@link #ANY}
 * placeholder, which stands for "any number" inside transform patterns.
 */
@API(API.Status.STABLE)
public final class Numeric {
    /**
     * The single "any number" placeholder.
     */
    @Nonnull
    public static final Numeric ANY = new Numeric(-1L);

    @Nonnull
    private static final Numeric ZERO = new Numeric(0L);

    // negative only for ANY
    private final long value;

    private Numeric(long value) {
        this.value = value;
    }

    /**
     * Get a concrete numeric.
     * @param value a non-negative value
     * @return the numeric holding {@code value}
     * @throws RewriteCoreArgumentException if {@code value} is negative
     */
    @Nonnull
    public static Numeric of(long value) {
        if (value < 0L) {
            throw new RewriteCoreArgumentException("numeric constants must not be negative",
                    LogMessageKeys.VALUE, value);
        }
        return value == 0L ? ZERO : new Numeric(value);
    }

    public boolean isWildcard() {
        return value < 0L;
    }

    /**
     * Get the concrete value.
     * @return the value
     * @throws WildcardEvaluationException if this is the {@link #ANY} placeholder
     */
    public long getValue() {
        if (isWildcard()) {
            throw new WildcardEvaluationException("attempted to take the value of an \"any number\" placeholder");
        }
        return value;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Numeric)o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isWildcard() ? "any" : Long.toString(value);
    }
}
