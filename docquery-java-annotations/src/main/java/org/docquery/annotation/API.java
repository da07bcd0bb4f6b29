/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
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

package org.docquery.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, method or field of the projection library is.
 *
 * <p>
 * Annotating a type sets the default stability of all of its members. A member may carry its own annotation
 * to override that default. Stability may increase at any time but may only decrease as described by each
 * {@link Status}.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of this library can use it. May change without notice.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. May change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release.
         */
        UNSTABLE,

        /**
         * Kept backwards compatible within a minor release line.
         */
        MAINTAINED,

        /**
         * Kept backwards compatible until the next major release.
         */
        STABLE
    }
}
