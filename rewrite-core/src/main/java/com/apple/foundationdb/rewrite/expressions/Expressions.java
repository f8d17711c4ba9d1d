/*
 * Expressions.java
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

import com.apple.foundationdb.rewrite.annotation.API;

import javax.annotation.Nonnull;

/**
 * Static factories for building expression trees and transform patterns.
 *
 * <pre>{@code
 *     // 0 + 1
 *     Expression query = add(number(0), number(1));
 *     // 0 + x, with x bound to "right"
 *     Expression pattern = add(number(0), any("right"));
 * }</pre>
 */
@API(API.Status.STABLE)
public class Expressions {

    private Expressions() {
    }

    @Nonnull
    public static NumericConstantExpression number(long value) {
        return new NumericConstantExpression(Numeric.of(value));
    }

    @Nonnull
    public static NumericConstantExpression number(long value, @Nonnull String bindingName) {
        return new NumericConstantExpression(Numeric.of(value), bindingName);
    }

    /**
     * An "any number" placeholder bound to the given name.
     * @param bindingName the name by which output templates refer to the matched value
     * @return the placeholder
     */
    @Nonnull
    public static NumericConstantExpression any(@Nonnull String bindingName) {
        return new NumericConstantExpression(Numeric.ANY, bindingName);
    }

    @Nonnull
    public static NumericConstantExpression any() {
        return new NumericConstantExpression(Numeric.ANY);
    }

    @Nonnull
    public static BinaryAdditionExpression add(@Nonnull Expression left, @Nonnull Expression right) {
        return new BinaryAdditionExpression(left, right);
    }

    @Nonnull
    public static BinaryAdditionExpression add(@Nonnull Expression left, @Nonnull Expression right, @Nonnull String bindingName) {
        return new BinaryAdditionExpression(left, right, bindingName);
    }
}
