/*
 * ListPipelineStage.java
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
import com.google.common.base.Preconditions;
import io.doclayer.query.MalformedContinuationTokenException;
import io.doclayer.query.QueryCoreException;
import io.doclayer.query.logging.LogMessageKeys;
import io.doclayer.query.values.DocValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * A stage that returns the documents of a list, a page at a time.
 * The continuation token is the base64 encoding of the position of the next document.
 */
@API(API.Status.EXPERIMENTAL)
public class ListPipelineStage implements QueryPipelineStage {
    @Nonnull
    private final List<DocValue> documents;
    private final double requestChargePerPage;
    private int nextPosition;
    private boolean done;
    private boolean closed;

    public ListPipelineStage(@Nonnull List<DocValue> documents, @Nullable String continuationToken) {
        this(documents, continuationToken, 0.0);
    }

    public ListPipelineStage(@Nonnull List<DocValue> documents, @Nullable String continuationToken,
                             double requestChargePerPage) {
        this.documents = documents;
        this.requestChargePerPage = requestChargePerPage;
        this.nextPosition = continuationToken == null ? 0 : decodePosition(continuationToken, documents.size());
    }

    /**
     * Get a factory that creates stages over the given list.
     * @param documents the documents the stages return
     * @return a factory of stages over {@code documents}
     */
    @Nonnull
    public static QueryPipelineStageFactory factory(@Nonnull List<DocValue> documents) {
        return continuationToken -> new ListPipelineStage(documents, continuationToken);
    }

    @Nonnull
    @Override
    public CompletableFuture<QueryPage> drainAsync(int maxElements, @Nonnull CancellationToken cancellationToken) {
        Preconditions.checkArgument(maxElements > 0, "max elements must be positive");
        if (cancellationToken.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("query was cancelled"));
        }
        if (done || closed) {
            return CompletableFuture.failedFuture(new QueryCoreException("list stage drained after it was done"));
        }
        int end = nextPosition + Math.min(documents.size() - nextPosition, maxElements);
        QueryPage.Builder page = QueryPage.newBuilder()
                .addDocuments(documents.subList(nextPosition, end))
                .setRequestCharge(requestChargePerPage);
        nextPosition = end;
        if (nextPosition < documents.size()) {
            page.setContinuationToken(encodePosition(nextPosition));
        } else {
            done = true;
        }
        return CompletableFuture.completedFuture(page.build());
    }

    @Override
    public boolean isDone() {
        return done;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    @Nonnull
    static String encodePosition(int position) {
        return Base64.getEncoder().encodeToString(ByteBuffer.allocate(Integer.BYTES).putInt(position).array());
    }

    private static int decodePosition(@Nonnull String continuationToken, int size) {
        final byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(continuationToken);
        } catch (IllegalArgumentException e) {
            throw new MalformedContinuationTokenException("list continuation is not base64", e)
                    .addLogInfo(LogMessageKeys.RAW_TOKEN, continuationToken);
        }
        if (bytes.length != Integer.BYTES) {
            throw new MalformedContinuationTokenException("list continuation has the wrong length",
                    LogMessageKeys.RAW_TOKEN, continuationToken);
        }
        int position = ByteBuffer.wrap(bytes).getInt();
        if (position < 0 || position > size) {
            throw new MalformedContinuationTokenException("list continuation is out of range",
                    LogMessageKeys.RAW_TOKEN, continuationToken);
        }
        return position;
    }
}
