/*
 * QueryIterator.java
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
import com.apple.foundationdb.async.AsyncUtil;
import com.google.common.base.Preconditions;
import io.doclayer.query.values.DocValue;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a {@link QueryPipelineStage} page by page, keeping a running total of the request charge.
 */
@API(API.Status.EXPERIMENTAL)
public class QueryIterator implements AutoCloseable {
    @Nonnull
    private final QueryPipelineStage stage;
    private final int maxItemCount;
    private double totalRequestCharge;

    public QueryIterator(@Nonnull QueryPipelineStage stage, int maxItemCount) {
        Preconditions.checkArgument(maxItemCount > 0, "max item count must be positive");
        this.stage = stage;
        this.maxItemCount = maxItemCount;
    }

    public boolean hasMoreResults() {
        return !stage.isDone();
    }

    @Nonnull
    public CompletableFuture<QueryPage> readNextAsync() {
        return readNextAsync(CancellationToken.NONE);
    }

    @Nonnull
    public CompletableFuture<QueryPage> readNextAsync(@Nonnull CancellationToken cancellationToken) {
        return stage.drainAsync(maxItemCount, cancellationToken).thenApply(page -> {
            totalRequestCharge += page.getRequestCharge();
            return page;
        });
    }

    /**
     * Read every remaining page and collect the documents.
     * @return a future that completes with all remaining documents in order
     */
    @Nonnull
    public CompletableFuture<List<DocValue>> asListAsync() {
        final List<DocValue> documents = new ArrayList<>();
        return AsyncUtil.whileTrue(() -> {
            if (!hasMoreResults()) {
                return AsyncUtil.READY_FALSE;
            }
            return readNextAsync().thenApply(page -> {
                documents.addAll(page.getDocuments());
                return hasMoreResults();
            });
        }).thenApply(vignore -> documents);
    }

    public double getTotalRequestCharge() {
        return totalRequestCharge;
    }

    @Override
    public void close() {
        stage.close();
    }
}
