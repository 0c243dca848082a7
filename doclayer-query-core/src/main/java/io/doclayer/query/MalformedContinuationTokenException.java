/*
 * MalformedContinuationTokenException.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a continuation token handed back by a caller does not have the structure this version of the
 * query core writes. A malformed token is never replaced by a fresh start, since that would silently return
 * documents the caller has already seen.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class MalformedContinuationTokenException extends QueryCoreException {
    public MalformedContinuationTokenException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public MalformedContinuationTokenException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public MalformedContinuationTokenException(@Nonnull String msg) {
        super(msg);
    }
}
