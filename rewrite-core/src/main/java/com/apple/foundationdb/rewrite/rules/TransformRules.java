/*
 * TransformRules.java
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

import com.apple.foundationdb.rewrite.annotation.API;

import javax.annotation.Nonnull;

import static com.apple.foundationdb.rewrite.expressions.Expressions.add;
import static com.apple.foundationdb.rewrite.expressions.Expressions.any;
import static com.apple.foundationdb.rewrite.expressions.Expressions.number;

/**
 * The built-in transforms.
 */
@API(API.Status.STABLE)
public class TransformRules {
    @Nonnull
    public static final String ADDITION_WITH_ZERO_ON_LEFT = "Left-wise Binary Addition with Zero";
    @Nonnull
    public static final String ADDITION_WITH_ZERO_ON_RIGHT = "Right-wise Binary Addition with Zero";

    private TransformRules() {
    }

    /**
     * Remove a zero added on the left, e.g. {@code 0 + 1 -> 1}.
     * @return the transform
     */
    @Nonnull
    public static Transform additionWithZeroOnLeft() {
        return new Transform(ADDITION_WITH_ZERO_ON_LEFT,
                add(number(0), any("right")),
                any("right"));
    }

    /**
     * Remove a zero added on the right, e.g. {@code 1 + 0 -> 1}.
     * @return the transform
     */
    @Nonnull
    public static Transform additionWithZeroOnRight() {
        return new Transform(ADDITION_WITH_ZERO_ON_RIGHT,
                add(any("left"), number(0)),
                any("left"));
    }
}
