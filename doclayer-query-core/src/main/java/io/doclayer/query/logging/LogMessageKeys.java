/*
 * LogMessageKeys.java
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

package io.doclayer.query.logging;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the query core.
 * Keys are consolidated here so that collisions and inconsistent spellings are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // continuation parsing
    RAW_TOKEN,
    RAW_JSON,
    RAW_BYTES,
    FIELD_NAME("field"),
    FIELD_COUNT,
    SIMPLE_VALUE,
    EXPECTED_TYPE,
    ACTUAL_TYPE,
    // distinct execution
    EXECUTION_ENVIRONMENT,
    DISTINCT_QUERY_TYPE,
    DISTINCT_MAP_SIZE,
    MAX_ELEMENTS,
    DOCUMENTS_IN("docs_in"),
    DOCUMENTS_OUT("docs_out"),
    DONE;

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
