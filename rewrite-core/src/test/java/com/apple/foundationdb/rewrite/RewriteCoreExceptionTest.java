/*
 * RewriteCoreExceptionTest.java
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

import com.apple.foundationdb.rewrite.logging.KeyValueLogMessage;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.apple.foundationdb.rewrite.expressions.Expressions.add;
import static com.apple.foundationdb.rewrite.expressions.Expressions.any;
import static com.apple.foundationdb.rewrite.expressions.Expressions.number;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RewriteCoreException} and its log info.
 */
public class RewriteCoreExceptionTest {

    @Test
    void logInfo() {
        final RewriteCoreException e = new RewriteCoreException("failed", LogMessageKeys.VALUE, 3, "other", "x");
        e.addLogInfo(LogMessageKeys.BINDING_NAME.toString(), "right");

        final Map<String, Object> logInfo = e.getLogInfo();
        assertEquals(3, logInfo.get("value"));
        assertEquals("x", logInfo.get("other"));
        assertEquals("right", logInfo.get("binding_name"));
        assertArrayEquals(new Object[] {"value", 3, "other", "x", "binding_name", "right"}, e.exportLogInfo());
        assertThrows(UnsupportedOperationException.class, () -> logInfo.put("more", 1));
    }

    @Test
    void noLogInfo() {
        final RewriteCoreException e = new RewriteCoreException("failed");
        assertTrue(e.getLogInfo().isEmpty());
        assertEquals(0, e.exportLogInfo().length);
    }

    @Test
    void unbalancedLogInfo() {
        assertThrows(IllegalArgumentException.class, () -> new RewriteCoreException("failed", "key"));
        assertThrows(IllegalArgumentException.class, () -> new RewriteCoreException("failed").addLogInfo("a", 1, "b"));
    }

    @Test
    void cause() {
        final IllegalStateException cause = new IllegalStateException("inner");
        assertSame(cause, new RewriteCoreException("outer", cause).getCause());
    }

    @Test
    void wildcardEvaluationCarriesContext() {
        final WildcardEvaluationException e = assertThrows(WildcardEvaluationException.class,
                () -> add(number(1), any("right")).evaluate());
        final String message = KeyValueLogMessage.build(e.getMessage()).addKeysAndValues(e.getLogInfo()).toString();
        assertEquals("attempted to evaluate an \"any number\" placeholder binding_name=\"right\"", message);
    }
}
