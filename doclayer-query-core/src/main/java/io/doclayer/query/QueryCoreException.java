/*
 * QueryCoreException.java
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

package io.doclayer.query;

import com.apple.foundationdb.annotation.API;
import io.doclayer.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown by the query core when something is wrong that the caller cannot fix by retrying.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class QueryCoreException extends LoggableException {
    public QueryCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public QueryCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public QueryCoreException(@Nonnull String msg) {
        super(msg);
    }
}
