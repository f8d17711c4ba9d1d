/*
 * ExpressionFlattenerTest.java
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

import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.apple.foundationdb.rewrite.expressions.Expressions.add;
import static com.apple.foundationdb.rewrite.expressions.Expressions.any;
import static com.apple.foundationdb.rewrite.expressions.Expressions.number;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link ExpressionFlattener}.
 */
public class ExpressionFlattenerTest {

    @Test
    void leaf() {
        final Expression leaf = number(3, "x");
        final List<Expression> expressions = ExpressionFlattener.flattenExpressions(leaf);
        assertThat(expressions, hasSize(1));
        assertSame(leaf, expressions.get(0));
        assertThat(ExpressionFlattener.flattenBindingNames(leaf), contains("x"));
    }

    @Test
    void postOrder() {
        final BinaryAdditionExpression left = add(number(1), number(2), "l");
        final BinaryAdditionExpression root = add(left, number(3, "r"), "root");

        final List<Expression> expressions = ExpressionFlattener.flattenExpressions(root);
        assertThat(expressions, hasSize(5));
        assertSame(left.getLeft(), expressions.get(0));
        assertSame(left.getRight(), expressions.get(1));
        assertSame(left, expressions.get(2));
        assertSame(root.getRight(), expressions.get(3));
        assertSame(root, expressions.get(4));

        assertThat(ExpressionFlattener.flattenBindingNames(root), contains("", "", "l", "r", "root"));
    }

    @Test
    void zeroOnLeftPattern() {
        assertThat(ExpressionFlattener.flattenBindingNames(add(number(0), any("right"))), contains("", "right", ""));
    }
}
