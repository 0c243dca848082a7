/*
 * LoggableKeysAndValues.java
 *
 * This source file is part of the DocLayer open source project
 *
 * Copyright 2025 the DocLayer project authors
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

package io.doclayer.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Common contract of objects that carry structured key/value pairs for logging.
 *
 * @param <T> the implementing type, returned from the mutators so calls can be chained
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the attached key/value pairs.
     *
     * @return an unmodifiable view of the attached pairs
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Attach a single key/value pair.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Attach a flattened list of pairs, keys at even positions and values at odd positions.
     *
     * @param keyValue flattened pairs
     * @return this object
     * @throws IllegalArgumentException if {@code keyValue} has an odd number of elements
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Flatten the attached pairs into the format accepted by {@link #addLogInfo(Object...)}.
     *
     * @return flattened pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
