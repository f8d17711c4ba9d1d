/*
 * OptimizerDriver.java
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

import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.expressions.Expression;
import com.apple.foundationdb.rewrite.logging.KeyValueLogMessage;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.apple.foundationdb.rewrite.expressions.Expressions.add;
import static com.apple.foundationdb.rewrite.expressions.Expressions.number;

/**
 * Runs the optimizer over a couple of fixed trees and checks that their values survive optimization.
 */
@API(API.Status.EXPERIMENTAL)
public class OptimizerDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(OptimizerDriver.class);

    @Nonnull
    private final ExpressionOptimizer optimizer;
    @Nonnull
    private final List<Scenario> scenarios;

    public OptimizerDriver() {
        this(new ExpressionOptimizer(), defaultScenarios());
    }

    public OptimizerDriver(@Nonnull ExpressionOptimizer optimizer, @Nonnull List<Scenario> scenarios) {
        this.optimizer = optimizer;
        this.scenarios = ImmutableList.copyOf(scenarios);
    }

    @Nonnull
    public static List<Scenario> defaultScenarios() {
        return ImmutableList.of(
                // 0 + 1 -> 1
                new Scenario("leftwise optimization", () -> add(number(0), number(1)), 1L),
                // 1 + 0 -> 1
                new Scenario("rightwise optimization", () -> add(number(1), number(0)), 1L));
    }

    /**
     * Run all scenarios.
     * @return the names of the scenarios that failed
     */
    @Nonnull
    public List<String> run() {
        final List<String> failures = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            if (!runScenario(scenario)) {
                failures.add(scenario.getName());
            }
        }
        return failures;
    }

    private boolean runScenario(@Nonnull Scenario scenario) {
        final Expression input = scenario.getInput();
        final Expression output;
        final long before;
        final long after;
        try {
            output = optimizer.optimize(input);
            before = input.evaluate();
            after = output.evaluate();
        } catch (RewriteCoreException e) {
            LOGGER.warn(KeyValueLogMessage.build("scenario raised an error",
                            LogMessageKeys.SCENARIO, scenario.getName(),
                            LogMessageKeys.BEFORE, input)
                    .addKeysAndValues(e.getLogInfo())
                    .toString(), e);
            return false;
        }
        final boolean passed = before == scenario.getExpected() && after == scenario.getExpected();
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of(passed ? "scenario passed" : "scenario failed",
                    LogMessageKeys.SCENARIO, scenario.getName(),
                    LogMessageKeys.BEFORE, input,
                    LogMessageKeys.AFTER, output,
                    LogMessageKeys.EXPECTED, scenario.getExpected(),
                    LogMessageKeys.ACTUAL, after));
        }
        return passed;
    }

    @SuppressWarnings("squid:S106") // command line output
    public static void main(String[] args) {
        final List<String> failures = new OptimizerDriver().run();
        if (failures.isEmpty()) {
            System.out.println("All tests passed!");
        } else {
            System.err.println("Failed: " + String.join(", ", failures));
            System.exit(1);
        }
    }

    /**
     * A named input tree and the value it should evaluate to before and after optimization.
     */
    public static class Scenario {
        @Nonnull
        private final String name;
        @Nonnull
        private final Supplier<Expression> input;
        private final long expected;

        public Scenario(@Nonnull String name, @Nonnull Supplier<Expression> input, long expected) {
            this.name = name;
            this.input = input;
            this.expected = expected;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public Expression getInput() {
            return input.get();
        }

        public long getExpected() {
            return expected;
        }
    }
}
