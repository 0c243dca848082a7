/*
 * CancellationToken.java
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

package io.doclayer.query.pipeline;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.concurrent.CancellationException;

/**
 * A cooperative cancellation flag shared between the caller of a query and the stages that execute it. Stages
 * check the flag before starting work; nothing is interrupted.
 */
@API(API.Status.EXPERIMENTAL)
public class CancellationToken {
    /**
     * A token that can never be cancelled.
     */
    @Nonnull
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("the NONE cancellation token cannot be cancelled");
        }
    };

    private volatile boolean cancellationRequested;

    public void cancel() {
        cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    /**
     * Throw if cancellation has been requested.
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancellationRequested() {
        if (cancellationRequested) {
            throw new CancellationException("query was cancelled");
        }
    }
}
