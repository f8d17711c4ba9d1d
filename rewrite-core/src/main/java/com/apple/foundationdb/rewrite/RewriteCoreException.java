/*
 * RewriteCoreException.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of all exceptions raised by the expression rewriter. Every failure of the rewriter is a programming
 * error (a pattern used as data, a badly authored transform, an unknown node kind), so this is unchecked.
 *
 * <p>
 * Besides its message, the exception carries a set of keys and values describing the context of the failure. They
 * can be logged with {@link com.apple.foundationdb.rewrite.logging.KeyValueLogMessage} so that the same kind of
 * failure is easy to search for later.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class RewriteCoreException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key-value pairs
     * @throws IllegalArgumentException if <code>keyValues</code> has odd length
     * @see #addLogInfo(Object...)
     */
    public RewriteCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public RewriteCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Get the log information attached to this exception.
     *
     * @return an unmodifiable view of the log information, in insertion order
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description key of the pair
     * @param object value of the pair
     * @return this exception
     */
    @Nonnull
    public RewriteCoreException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a list of key/value pairs to the log information. Every even element is a key and the odd element after
     * it is its value, so <code>["k0", "v0", "k1", "v1"]</code> adds two pairs. This is the format produced by
     * {@link #exportLogInfo()}.
     *
     * @param keyValue flattened key-value pairs
     * @return this exception
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    public RewriteCoreException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information as a flattened array of alternating keys and values.
     *
     * @return the flattened key-value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        final Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}
