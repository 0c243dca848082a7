/*
 * DistinctQueryPipelineStage.java
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

package io.doclayer.query.distinct;

import com.apple.foundationdb.annotation.API;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.doclayer.query.ExecutionEnvironment;
import io.doclayer.query.MalformedContinuationTokenException;
import io.doclayer.query.QueryCoreException;
import io.doclayer.query.QueryExecuteProperties;
import io.doclayer.query.logging.KeyValueLogMessage;
import io.doclayer.query.logging.LogMessageKeys;
import io.doclayer.query.pipeline.CancellationToken;
import io.doclayer.query.pipeline.QueryPage;
import io.doclayer.query.pipeline.QueryPipelineStage;
import io.doclayer.query.pipeline.QueryPipelineStageFactory;
import io.doclayer.query.values.DocValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * A pipeline stage that removes duplicate documents from the pages of the stage below it.
 *
 * <p>
 * Every document drained from the source is added to a {@link DistinctMap}, and only documents the map had not
 * seen are returned. The continuation of this stage is a {@link DistinctContinuationToken} made of the source's
 * continuation and the map's continuation, so that a resumed query keeps rejecting documents returned before it
 * was suspended.
 * </p>
 *
 * <p>
 * Only {@link DistinctQueryType#ORDERED} queries can be resumed. In the {@link ExecutionEnvironment#CLIENT}
 * environment, each page of an ordered query carries its continuation token, while pages of an unordered query
 * carry {@link #DISALLOW_CONTINUATION_MESSAGE} instead. In the {@link ExecutionEnvironment#COMPUTE} environment,
 * pages never carry a token and {@link #getContinuationToken()} builds one when asked.
 * </p>
 *
 * <p>
 * The stage is driven by a single caller: a drain must complete before the next one starts.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class DistinctQueryPipelineStage implements QueryPipelineStage {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(DistinctQueryPipelineStage.class);

    public static final String DISALLOW_CONTINUATION_MESSAGE = "DISTINCT queries only return continuation tokens when "
            + "there is a matching ORDER BY clause. For example if your query is 'SELECT DISTINCT VALUE c.name FROM c', "
            + "then rewrite it as 'SELECT DISTINCT VALUE c.name FROM c ORDER BY c.name'.";
    public static final String USE_GET_CONTINUATION_TOKEN_MESSAGE = "DISTINCT queries running in the compute "
            + "environment do not return continuation tokens on their pages. Call getContinuationToken() to get one.";

    @Nonnull
    private final ExecutionEnvironment executionEnvironment;
    @Nonnull
    private final DistinctMap distinctMap;
    @Nonnull
    private final QueryPipelineStage source;
    private final int maxItemCount;
    @Nullable
    private String sourceToken;
    private boolean done;

    private DistinctQueryPipelineStage(@Nonnull ExecutionEnvironment executionEnvironment,
                                       @Nonnull DistinctMap distinctMap,
                                       @Nonnull QueryPipelineStage source,
                                       @Nullable String sourceToken,
                                       int maxItemCount) {
        this.executionEnvironment = executionEnvironment;
        this.distinctMap = distinctMap;
        this.source = source;
        this.sourceToken = sourceToken;
        this.maxItemCount = maxItemCount;
    }

    /**
     * Create a stage with the default page size.
     * @param executionEnvironment where the query runs
     * @param continuationToken a continuation returned by an earlier stage of the same query, or {@code null}
     * @param sourceFactory creates the source stage from the source part of the continuation
     * @param distinctQueryType whether the query is ordered
     * @return the new stage
     * @throws MalformedContinuationTokenException if the continuation cannot be parsed
     */
    @Nonnull
    public static DistinctQueryPipelineStage create(@Nonnull ExecutionEnvironment executionEnvironment,
                                                    @Nullable String continuationToken,
                                                    @Nonnull QueryPipelineStageFactory sourceFactory,
                                                    @Nonnull DistinctQueryType distinctQueryType) {
        return create(QueryExecuteProperties.newBuilder()
                        .setExecutionEnvironment(executionEnvironment)
                        .setDistinctQueryType(distinctQueryType)
                        .build(),
                continuationToken, sourceFactory);
    }

    /**
     * Create a stage. A malformed continuation is an error; the query is never silently restarted, since that
     * would return documents again.
     * @param properties the environment, query type and page size of the query
     * @param continuationToken a continuation returned by an earlier stage of the same query, or {@code null}
     * @param sourceFactory creates the source stage from the source part of the continuation
     * @return the new stage
     * @throws MalformedContinuationTokenException if the continuation cannot be parsed
     */
    @Nonnull
    public static DistinctQueryPipelineStage create(@Nonnull QueryExecuteProperties properties,
                                                    @Nullable String continuationToken,
                                                    @Nonnull QueryPipelineStageFactory sourceFactory) {
        Objects.requireNonNull(sourceFactory);
        String sourceToken = null;
        String distinctMapToken = null;
        if (continuationToken != null) {
            DistinctContinuationToken parsed = DistinctContinuationToken.parse(continuationToken);
            sourceToken = parsed.getSourceToken();
            distinctMapToken = parsed.getDistinctMapToken();
        }
        DistinctMap distinctMap = DistinctMap.create(properties.getDistinctQueryType(), distinctMapToken);
        QueryPipelineStage source = sourceFactory.create(sourceToken);
        if (continuationToken != null && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("resuming distinct query",
                    LogMessageKeys.EXECUTION_ENVIRONMENT, properties.getExecutionEnvironment(),
                    LogMessageKeys.DISTINCT_QUERY_TYPE, properties.getDistinctQueryType(),
                    LogMessageKeys.DISTINCT_MAP_SIZE, distinctMap.size()));
        }
        return new DistinctQueryPipelineStage(properties.getExecutionEnvironment(), distinctMap, source,
                sourceToken, properties.getMaxItemCount());
    }

    /**
     * Drain the next page with the page size this stage was created with.
     * @param cancellationToken checked before the source is drained
     * @return a future that completes with the next page of distinct documents
     */
    @Nonnull
    public CompletableFuture<QueryPage> drainAsync(@Nonnull CancellationToken cancellationToken) {
        return drainAsync(maxItemCount, cancellationToken);
    }

    /**
     * Drain the next page of the source and return the documents in it that have not been returned before.
     *
     * <p>
     * If cancellation has been requested, the returned future fails with a {@link CancellationException} and
     * neither the source nor the distinct map is touched. If the source fails, the returned future fails with
     * the source's exception as its cause. Draining a stage that is done fails with a {@link QueryCoreException}.
     * </p>
     *
     * @param maxElements the most documents to request from the source
     * @param cancellationToken checked before the source is drained
     * @return a future that completes with the next page of distinct documents
     */
    @Nonnull
    @Override
    public CompletableFuture<QueryPage> drainAsync(int maxElements, @Nonnull CancellationToken cancellationToken) {
        Preconditions.checkArgument(maxElements > 0, "max elements must be positive");
        if (cancellationToken.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("distinct query was cancelled"));
        }
        if (done) {
            return CompletableFuture.failedFuture(new QueryCoreException("distinct query stage drained after it was done",
                    LogMessageKeys.EXECUTION_ENVIRONMENT, executionEnvironment,
                    LogMessageKeys.DISTINCT_QUERY_TYPE, distinctMap.getDistinctQueryType()));
        }
        final CompletableFuture<QueryPage> sourcePage;
        try {
            sourcePage = source.drainAsync(maxElements, cancellationToken);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sourcePage.thenApply(page -> deduplicate(page, maxElements));
    }

    // Runs to completion without suspending, so a page's documents are either all added to the map or none are.
    @Nonnull
    private QueryPage deduplicate(@Nonnull QueryPage page, int maxElements) {
        QueryPage.Builder builder = QueryPage.newBuilder()
                .setRequestCharge(page.getRequestCharge())
                .setActivityId(page.getActivityId());
        int documentsOut = 0;
        for (DocValue document : page.getDocuments()) {
            if (distinctMap.add(document).isNewlyAdded()) {
                builder.addDocument(document);
                documentsOut++;
            }
        }
        sourceToken = page.getContinuationToken();
        done = sourceToken == null;

        switch (executionEnvironment) {
            case CLIENT:
                if (distinctMap.getDistinctQueryType() == DistinctQueryType.ORDERED) {
                    if (!done) {
                        builder.setContinuationToken(currentContinuation().toString());
                    }
                } else {
                    builder.setDisallowContinuationTokenMessage(DISALLOW_CONTINUATION_MESSAGE);
                }
                break;
            case COMPUTE:
                builder.setDisallowContinuationTokenMessage(USE_GET_CONTINUATION_TOKEN_MESSAGE);
                break;
            default:
                throw new QueryCoreException("unknown execution environment",
                        LogMessageKeys.EXECUTION_ENVIRONMENT, executionEnvironment);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("drained distinct page",
                    LogMessageKeys.EXECUTION_ENVIRONMENT, executionEnvironment,
                    LogMessageKeys.MAX_ELEMENTS, maxElements,
                    LogMessageKeys.DOCUMENTS_IN, page.getDocuments().size(),
                    LogMessageKeys.DOCUMENTS_OUT, documentsOut,
                    LogMessageKeys.DISTINCT_MAP_SIZE, distinctMap.size(),
                    LogMessageKeys.DONE, done));
        }
        return builder.build();
    }

    @Nonnull
    private DistinctContinuationToken currentContinuation() {
        return new DistinctContinuationToken(sourceToken, distinctMap.getContinuationToken());
    }

    /**
     * Build the continuation of a query running in the {@link ExecutionEnvironment#COMPUTE} environment.
     * @return the continuation as a value, or empty if the query is done
     * @throws QueryCoreException if the stage runs in the {@link ExecutionEnvironment#CLIENT} environment, where
     * continuations are returned on the pages
     */
    @Nonnull
    public Optional<DocValue> getContinuationToken() {
        if (executionEnvironment != ExecutionEnvironment.COMPUTE) {
            throw new QueryCoreException("continuation tokens are only built on request in the compute environment",
                    LogMessageKeys.EXECUTION_ENVIRONMENT, executionEnvironment);
        }
        if (done) {
            return Optional.empty();
        }
        return Optional.of(currentContinuation().toDocValue());
    }

    @Nonnull
    public ExecutionEnvironment getExecutionEnvironment() {
        return executionEnvironment;
    }

    @Nonnull
    public DistinctQueryType getDistinctQueryType() {
        return distinctMap.getDistinctQueryType();
    }

    @VisibleForTesting
    @Nonnull
    DistinctMap getDistinctMap() {
        return distinctMap;
    }

    @Override
    public boolean isDone() {
        return done;
    }

    @Override
    public void close() {
        source.close();
    }
}
