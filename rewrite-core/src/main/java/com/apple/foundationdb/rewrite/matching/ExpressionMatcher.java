/*
 * ExpressionMatcher.java
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
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.expressions.Numeric;
import com.apple.foundationdb.rewrite.expressions.NumericConstantExpression;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Structural matching of a pattern tree against a query tree.
 *
 * <p>
 * A pattern matches a query if both trees have the same shape and every pair of numeric leaves at the same position
 * matches. A placeholder leaf ({@link Numeric#ANY}) on either side matches any numeric leaf, including another
 * placeholder; two concrete leaves match when their values are equal. Additions are not commutative here:
 * {@code 0 + x} does not match {@code 1 + 0}. Binding names are ignored.
 * </p>
 */
@API(API.Status.STABLE)
public class ExpressionMatcher {

    private ExpressionMatcher() {
    }

    /**
     * Match a pattern against a query.
     * @param pattern the pattern tree
     * @param query the query tree
     * @return {@code true} if {@code pattern} matches {@code query}
     */
    public static boolean matches(@Nonnull Expression pattern, @Nonnull Expression query) {
        if (pattern.getKind() != query.getKind()) {
            return false;
        }
        switch (pattern.getKind()) {
            case BINARY_ADDITION:
                final BinaryAdditionExpression additionPattern = (BinaryAdditionExpression)pattern;
                final BinaryAdditionExpression additionQuery = (BinaryAdditionExpression)query;
                return matches(additionPattern.getLeft(), additionQuery.getLeft())
                       && matches(additionPattern.getRight(), additionQuery.getRight());
            case NUMERIC_CONSTANT:
                return matches(((NumericConstantExpression)pattern).getNumeric(),
                        ((NumericConstantExpression)query).getNumeric());
            default:
                throw new RewriteCoreException("unreachable",
                        LogMessageKeys.EXPRESSION_KIND, pattern.getKind());
        }
    }

    /**
     * Match two numerics.
     * @param pattern the numeric of the pattern leaf
     * @param query the numeric of the query leaf
     * @return {@code true} if either is a placeholder or both hold the same value
     */
    public static boolean matches(@Nonnull Numeric pattern, @Nonnull Numeric query) {
        if (pattern.isWildcard() || query.isWildcard()) {
            return true;
        }
        return pattern.getValue() == query.getValue();
    }
}
