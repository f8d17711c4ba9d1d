/*
 * OptimizerDriverTest.java
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
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.List;
import java.util.stream.Collectors;

import static com.apple.foundationdb.rewrite.expressions.Expressions.add;
import static com.apple.foundationdb.rewrite.expressions.Expressions.any;
import static com.apple.foundationdb.rewrite.expressions.Expressions.number;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

/**
 * Tests for {@link OptimizerDriver}.
 */
public class OptimizerDriverTest {
    @RegisterExtension
    final LogAppenderExtension logs = new LogAppenderExtension("driverLogs", OptimizerDriver.class, Level.INFO);

    @Test
    void defaultScenariosPass() {
        assertThat(OptimizerDriver.defaultScenarios(), hasSize(2));
        assertThat(new OptimizerDriver().run(), empty());
    }

    @Test
    void failingScenarioIsReported() {
        final OptimizerDriver driver = new OptimizerDriver(new ExpressionOptimizer(), ImmutableList.of(
                new OptimizerDriver.Scenario("right", () -> add(number(2), number(0)), 2L),
                new OptimizerDriver.Scenario("wrong", () -> add(number(2), number(2)), 5L)));
        assertThat(driver.run(), contains("wrong"));
    }

    @Test
    void driverOptimizerWithoutTransforms() {
        final ExpressionOptimizer none = new ExpressionOptimizer(OptimizerConfiguration.builder()
                .disableTransforms(TransformRuleSet.DEFAULT.getTransforms().stream()
                        .map(Transform::getName)
                        .collect(Collectors.toList()))
                .build());
        // values are still preserved, optimization or not
        assertThat(new OptimizerDriver(none, OptimizerDriver.defaultScenarios()).run(), empty());
    }

    @Test
    void scenarioWithPlaceholderFails() {
        final OptimizerDriver driver = new OptimizerDriver(new ExpressionOptimizer(), ImmutableList.of(
                new OptimizerDriver.Scenario("placeholder", () -> add(number(3), any("x")), 3L)));
        assertThat(driver.run(), contains("placeholder"));
        final List<String> warnings = logs.getLogEventMessages(Level.WARN);
        assertThat(warnings, hasSize(1));
        assertThat(warnings.get(0), containsString("scenario=\"placeholder\""));
        assertThat(warnings.get(0), containsString("binding_name=\"x\""));
    }

    @Test
    void passingScenariosAreLogged() {
        new OptimizerDriver().run();
        assertThat(logs.getLogEventMessages(Level.INFO), contains(
                containsString("scenario=\"leftwise optimization\""),
                containsString("scenario=\"rightwise optimization\"")));
    }
}
