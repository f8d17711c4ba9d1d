/*
 * OptimizerConfigurationTest.java
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

package com.apple.foundationdb.rewrite;

import com.apple.foundationdb.rewrite.rules.Transform;
import com.apple.foundationdb.rewrite.rules.TransformRuleSet;
import com.apple.foundationdb.rewrite.rules.TransformRules;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static com.apple.foundationdb.rewrite.expressions.Expressions.number;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link OptimizerConfiguration}.
 */
public class OptimizerConfigurationTest {

    @Test
    void defaults() {
        final OptimizerConfiguration configuration = OptimizerConfiguration.defaultConfiguration();
        assertSame(TransformRuleSet.DEFAULT, configuration.getRuleSet());
        assertThat(configuration.getDisabledTransforms(), empty());
        for (Transform transform : configuration.getRuleSet().getTransforms()) {
            assertTrue(configuration.isTransformEnabled(transform));
        }
        assertSame(configuration, new ExpressionOptimizer().getConfiguration());
    }

    @Test
    void disableAndEnable() {
        final OptimizerConfiguration configuration = OptimizerConfiguration.builder()
                .disableTransforms(ImmutableList.of(TransformRules.ADDITION_WITH_ZERO_ON_LEFT, TransformRules.ADDITION_WITH_ZERO_ON_RIGHT))
                .enableTransform(TransformRules.ADDITION_WITH_ZERO_ON_RIGHT)
                .build();
        assertFalse(configuration.isTransformEnabled(TransformRules.additionWithZeroOnLeft()));
        assertTrue(configuration.isTransformEnabled(TransformRules.additionWithZeroOnRight()));
    }

    @Test
    void toBuilderKeepsSettings() {
        final OptimizerConfiguration configuration = OptimizerConfiguration.builder()
                .disableTransform(TransformRules.ADDITION_WITH_ZERO_ON_LEFT)
                .build();
        final OptimizerConfiguration copy = configuration.toBuilder()
                .disableTransform(TransformRules.ADDITION_WITH_ZERO_ON_RIGHT)
                .build();
        assertThat(configuration.getDisabledTransforms(), containsInAnyOrder(TransformRules.ADDITION_WITH_ZERO_ON_LEFT));
        assertThat(copy.getDisabledTransforms(),
                containsInAnyOrder(TransformRules.ADDITION_WITH_ZERO_ON_LEFT, TransformRules.ADDITION_WITH_ZERO_ON_RIGHT));
        assertSame(configuration.getRuleSet(), copy.getRuleSet());
    }

    @Test
    void unknownDisabledTransform() {
        final InvalidTransformException e = assertThrows(InvalidTransformException.class,
                () -> OptimizerConfiguration.builder().disableTransform("nope").build());
        assertEquals("nope", e.getLogInfo().get("transform"));
    }

    @Test
    void disabledTransformMustBelongToRuleSet() {
        final TransformRuleSet ruleSet = TransformRuleSet.of(new Transform("one", number(1), number(1)));
        assertThrows(InvalidTransformException.class, () -> OptimizerConfiguration.builder()
                .setRuleSet(ruleSet)
                .disableTransform(TransformRules.ADDITION_WITH_ZERO_ON_LEFT)
                .build());
    }
}
