/*
 * TransformSubstitutionTest.java
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

import com.apple.foundationdb.rewrite.UnboundPlaceholderException;
import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.Numeric;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;
import com.apple.foundationdb.rewrite.matching.PlaceholderBindings;
import org.junit.jupiter.api.Test;

import static com.apple.foundationdb.rewrite.expressions.Expressions.add;
import static com.apple.foundationdb.rewrite.expressions.Expressions.any;
import static com.apple.foundationdb.rewrite.expressions.Expressions.number;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TransformSubstitution}.
 */
public class TransformSubstitutionTest {

    @Test
    void placeholderTakesBoundValue() {
        final BinaryAdditionExpression query = add(number(3), number(4));
        final PlaceholderBindings bindings = PlaceholderBindings.bind(add(any("a"), any("b")), query);

        final Expression result = TransformSubstitution.instantiate(add(any("a"), number(7)), bindings);
        assertEquals(add(number(3), number(7)), result);
        assertThat(((BinaryAdditionExpression)result).getLeft(), not(sameInstance(query.getLeft())));
    }

    @Test
    void bindingNamesAreDropped() {
        final PlaceholderBindings bindings = PlaceholderBindings.bind(add(any("a"), any("b")), add(number(3, "q"), number(4)));

        final Expression result = TransformSubstitution.instantiate(add(any("a"), number(7, "literal"), "top"), bindings);
        assertEquals(add(number(3), number(7)), result);
        assertFalse(result.hasBindingName());
    }

    @Test
    void literalLeafIsCopied() {
        final Expression template = number(5);
        final PlaceholderBindings bindings = PlaceholderBindings.bind(any("a"), number(1));
        final Expression result = TransformSubstitution.instantiate(template, bindings);
        assertEquals(number(5), result);
        assertThat(result, not(sameInstance(template)));
    }

    @Test
    void placeholderBoundToPlaceholder() {
        final PlaceholderBindings bindings = PlaceholderBindings.bind(any("a"), any());
        final Expression result = TransformSubstitution.instantiate(any("a"), bindings);
        assertEquals(Numeric.ANY, ((NumericConstantExpression)result).getNumeric());
    }

    @Test
    void missingBinding() {
        final PlaceholderBindings bindings = PlaceholderBindings.bind(add(number(0), any("right")), add(number(0), number(4)));
        assertThrows(UnboundPlaceholderException.class, () -> TransformSubstitution.instantiate(any("missing"), bindings));
    }

    @Test
    void bindingToAddition() {
        final PlaceholderBindings bindings = PlaceholderBindings.bind(
                add(add(any("a"), any("b"), "sum"), number(0)),
                add(add(number(1), number(2)), number(0)));
        assertThrows(UnboundPlaceholderException.class, () -> TransformSubstitution.instantiate(any("sum"), bindings));
    }
}
