/*
 * QueryPipelineStage.java
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
import java.util.concurrent.CompletableFuture;

/**
 * A resumable, paged source of documents.
 *
 * <p>
 * Each call to {@link #drainAsync(int, CancellationToken)} returns the next page. The stage is done once it has
 * returned a page without a continuation token; draining a done stage is an error. A stage is driven by one
 * caller at a time: the future from one drain must complete before the next drain is started.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface QueryPipelineStage extends AutoCloseable {
    /**
     * Get the next page of documents.
     * @param maxElements the most documents the page should hold
     * @param cancellationToken checked before any work is started
     * @return a future that completes with the next page, or completes exceptionally with the failure
     */
    @Nonnull
    CompletableFuture<QueryPage> drainAsync(int maxElements, @Nonnull CancellationToken cancellationToken);

    /**
     * Whether the stage has returned its last page.
     * @return {@code true} if the stage has nothing more to return
     */
    boolean isDone();

    @Override
    void close();
}
