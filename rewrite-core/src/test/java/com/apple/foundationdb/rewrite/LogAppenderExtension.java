/*
 * LogAppenderExtension.java
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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Records what a rewriter class logs while a test runs. The logger of {@code loggingClass} is lowered to the
 * requested level for the test and restored afterwards.
 */
public class LogAppenderExtension implements BeforeEachCallback, AfterEachCallback {
    @Nonnull
    private final String appenderName;
    @Nonnull
    private final Class<?> loggingClass;
    @Nonnull
    private final Level captureLevel;
    @Nonnull
    private final List<LogEvent> captured = new CopyOnWriteArrayList<>();

    private CapturingAppender appender;
    private Logger logger;
    private Level previousLevel;

    public LogAppenderExtension(@Nonnull String appenderName, @Nonnull Class<?> loggingClass, @Nonnull Level captureLevel) {
        this.appenderName = appenderName;
        this.loggingClass = loggingClass;
        this.captureLevel = captureLevel;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        captured.clear();
        appender = new CapturingAppender(appenderName, captured);
        appender.start();
        logger = (Logger)LogManager.getLogger(loggingClass);
        previousLevel = logger.getLevel();
        logger.addAppender(appender);
        logger.setLevel(captureLevel);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        if (logger != null) {
            logger.removeAppender(appender);
            logger.setLevel(previousLevel);
        }
        if (appender != null) {
            appender.stop();
        }
    }

    @Nonnull
    public List<LogEvent> getLogEvents() {
        return captured;
    }

    /**
     * Get the rendered messages, in the order they were logged.
     * @return the messages
     */
    @Nonnull
    public List<String> getLogEventMessages() {
        return captured.stream()
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }

    @Nonnull
    public List<String> getLogEventMessages(@Nonnull Level level) {
        return captured.stream()
                .filter(event -> level.equals(event.getLevel()))
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }

    private static final class CapturingAppender extends AbstractAppender {
        @Nonnull
        private final List<LogEvent> sink;

        CapturingAppender(@Nonnull String name, @Nonnull List<LogEvent> sink) {
            super(name, null, null, false, Property.EMPTY_ARRAY);
            this.sink = sink;
        }

        @Override
        public void append(LogEvent event) {
            sink.add(event.toImmutable());
        }
    }
}
