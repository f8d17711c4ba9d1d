/*
 * LogMessageKeys.java
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

package com.apple.foundationdb.rewrite.logging;

import com.apple.foundationdb.rewrite.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the expression rewriter.
 * All keys are kept here so that collisions and inconsistent spellings are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // expressions
    EXPRESSION("expr"),
    EXPRESSION_KIND("kind"),
    VALUE,
    BINDING_NAME,
    CHILD,
    // transforms
    TRANSFORM_NAME("transform"),
    INPUT_PATTERN,
    OUTPUT_PATTERN,
    BINDING_NAMES,
    // optimizer
    BEFORE,
    AFTER,
    REWRITE_COUNT,
    RULE_SET,
    // driver
    SCENARIO,
    EXPECTED,
    ACTUAL;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
