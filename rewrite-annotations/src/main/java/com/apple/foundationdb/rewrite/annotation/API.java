/*
 * API.java
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

package com.apple.foundationdb.rewrite.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, field, constructor or method of the expression rewriter is.
 *
 * <p>
 * Members inherit the status of their enclosing type unless they are annotated themselves. A status may only
 * move towards {@link Status#STABLE} within a minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of the rewriter can reach it. Not for external callers.
         */
        INTERNAL,

        /**
         * Still being shaped. May change or go away without notice.
         */
        EXPERIMENTAL,

        /**
         * Kept source compatible until the next minor release.
         */
        UNSTABLE,

        /**
         * Kept source compatible until the next major release.
         */
        STABLE
    }
}
