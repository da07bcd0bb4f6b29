/*
 * LoggableKeysAndValues.java
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

package org.docquery.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured key/value context for log lines. A log line is a fixed title
 * plus a set of keys and values describing the circumstances, e.g. the field name and node type
 * of a projection node that could not be copied. Keeping the title fixed makes such lines easy
 * to search for and aggregate.
 *
 * @param <T> the implementing type, returned from the fluent setters
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get all key/value pairs attached so far.
     *
     * @return an unmodifiable map of the log info
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Attach one key/value pair.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Attach a flattened sequence of pairs, keys at even positions and values at odd positions.
     *
     * @param keyValue flattened key/value pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Flatten the attached pairs into the same layout accepted by {@link #addLogInfo(Object...)}.
     *
     * @return flattened key/value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
