/*
 * DistinctQueryPipelineStageTest.java
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

import io.doclayer.query.ExecutionEnvironment;
import io.doclayer.query.MalformedContinuationTokenException;
import io.doclayer.query.QueryCoreException;
import io.doclayer.query.QueryExecuteProperties;
import io.doclayer.query.pipeline.CancellationToken;
import io.doclayer.query.pipeline.ListPipelineStage;
import io.doclayer.query.pipeline.QueryPage;
import io.doclayer.query.values.DocNumber;
import io.doclayer.query.values.DocObject;
import io.doclayer.query.values.DocString;
import io.doclayer.query.values.DocValue;
import io.doclayer.query.values.DocValueJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DistinctQueryPipelineStage}.
 */
class DistinctQueryPipelineStageTest {
    private static final DocValue ONE = DocNumber.of(1L);
    private static final DocValue TWO = DocNumber.of(2L);
    private static final DocValue THREE = DocNumber.of(3L);
    private static final DocValue FOUR = DocNumber.of(4L);
    private static final DocValue A = DocString.of("a");

    @Nonnull
    private static ScriptedPipelineStage.Script orderedScript() {
        return new ScriptedPipelineStage.Script()
                .page(null, "U1", Arrays.asList(ONE, TWO))
                .page("U1", "U2", Arrays.asList(TWO, THREE))
                .page("U2", null, Arrays.asList(THREE, FOUR));
    }

    @Nonnull
    private static QueryPage drain(@Nonnull DistinctQueryPipelineStage stage) {
        return stage.drainAsync(10, CancellationToken.NONE).join();
    }

    @Test
    void unorderedClientDisallowsContinuation() {
        ScriptedPipelineStage.Script script = new ScriptedPipelineStage.Script()
                .page(null, null, Arrays.asList(ONE, ONE, TWO, A));
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.UNORDERED);
        QueryPage page = drain(stage);
        assertEquals(Arrays.asList(ONE, TWO, A), page.getDocuments());
        assertNull(page.getContinuationToken());
        assertEquals(DistinctQueryPipelineStage.DISALLOW_CONTINUATION_MESSAGE, page.getDisallowContinuationTokenMessage());
        assertTrue(stage.isDone());
    }

    @Test
    void unorderedClientDeduplicatesAcrossPages() {
        ScriptedPipelineStage.Script script = new ScriptedPipelineStage.Script()
                .page(null, "U1", Arrays.asList(ONE, TWO))
                .page("U1", null, Arrays.asList(TWO, ONE, A, A));
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.UNORDERED);
        QueryPage first = drain(stage);
        assertNull(first.getContinuationToken());
        assertEquals(DistinctQueryPipelineStage.DISALLOW_CONTINUATION_MESSAGE, first.getDisallowContinuationTokenMessage());
        assertFalse(stage.isDone());
        assertEquals(Arrays.asList(A), drain(stage).getDocuments());
        assertTrue(stage.isDone());
    }

    @Test
    void orderedClientResumesFromPageToken() {
        ScriptedPipelineStage.Script script = orderedScript();
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.ORDERED);
        QueryPage first = drain(stage);
        assertEquals(Arrays.asList(ONE, TWO), first.getDocuments());
        assertNull(first.getDisallowContinuationTokenMessage());
        String token = first.getContinuationToken();
        assertNotNull(token);
        assertEquals("U1", DistinctContinuationToken.parse(token).getSourceToken());
        stage.close();

        DistinctQueryPipelineStage resumed = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, token,
                script.factory(), DistinctQueryType.ORDERED);
        QueryPage second = drain(resumed);
        assertEquals(Arrays.asList(THREE), second.getDocuments());
        assertEquals("U2", DistinctContinuationToken.parse(second.getContinuationToken()).getSourceToken());

        QueryPage last = drain(resumed);
        assertEquals(Arrays.asList(FOUR), last.getDocuments());
        assertNull(last.getContinuationToken());
        assertNull(last.getDisallowContinuationTokenMessage());
        assertTrue(resumed.isDone());
        assertEquals(2, script.created);
        assertEquals(1, script.closed);
    }

    @Test
    void computeNeverPutsTokenOnPage() {
        ScriptedPipelineStage.Script script = orderedScript();
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.COMPUTE, null,
                script.factory(), DistinctQueryType.ORDERED);
        QueryPage first = drain(stage);
        assertEquals(Arrays.asList(ONE, TWO), first.getDocuments());
        assertNull(first.getContinuationToken());
        assertEquals(DistinctQueryPipelineStage.USE_GET_CONTINUATION_TOKEN_MESSAGE,
                first.getDisallowContinuationTokenMessage());

        Optional<DocValue> continuation = stage.getContinuationToken();
        assertTrue(continuation.isPresent());
        DistinctContinuationToken token = DistinctContinuationToken.parse(continuation.get());
        assertEquals("U1", token.getSourceToken());

        DistinctQueryPipelineStage resumed = DistinctQueryPipelineStage.create(ExecutionEnvironment.COMPUTE,
                continuation.get().toString(), script.factory(), DistinctQueryType.ORDERED);
        QueryPage second = drain(resumed);
        assertEquals(Arrays.asList(THREE), second.getDocuments());
        assertNull(second.getContinuationToken());
        QueryPage last = drain(resumed);
        assertEquals(Arrays.asList(FOUR), last.getDocuments());
        assertNull(last.getContinuationToken());
        assertEquals(Optional.empty(), resumed.getContinuationToken());
    }

    @Test
    void computeTokenBeforeFirstDrain() {
        ScriptedPipelineStage.Script script = orderedScript();
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.COMPUTE, null,
                script.factory(), DistinctQueryType.ORDERED);
        DocValue continuation = stage.getContinuationToken().orElseThrow();
        DistinctContinuationToken token = DistinctContinuationToken.parse(continuation);
        assertNull(token.getSourceToken());
        assertEquals(0, DistinctMap.create(DistinctQueryType.ORDERED, token.getDistinctMapToken()).size());
    }

    @Test
    void clientCannotBuildTokenOnRequest() {
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                orderedScript().factory(), DistinctQueryType.ORDERED);
        assertThrows(QueryCoreException.class, stage::getContinuationToken);
    }

    @ParameterizedTest
    @EnumSource(ExecutionEnvironment.class)
    void cancelledBeforeDrain(ExecutionEnvironment environment) {
        ScriptedPipelineStage.Script script = orderedScript();
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(environment, null,
                script.factory(), DistinctQueryType.ORDERED);
        drain(stage);
        int sizeBefore = stage.getDistinctMap().size();

        CancellationToken cancellationToken = new CancellationToken();
        cancellationToken.cancel();
        CompletableFuture<QueryPage> future = stage.drainAsync(10, cancellationToken);
        assertTrue(future.isCompletedExceptionally());
        assertThrows(CancellationException.class, future::join);
        assertEquals(1, script.drains);
        assertEquals(sizeBefore, stage.getDistinctMap().size());
        assertFalse(stage.isDone());

        // The stage can still be drained once the caller stops cancelling.
        assertEquals(Arrays.asList(THREE), drain(stage).getDocuments());
    }

    @Test
    void upstreamFailurePassesThrough() {
        IllegalStateException failure = new IllegalStateException("service unavailable");
        ScriptedPipelineStage.Script script = new ScriptedPipelineStage.Script().failWith(failure);
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.ORDERED);
        ExecutionException e = assertThrows(ExecutionException.class, () -> stage.drainAsync(10, CancellationToken.NONE).get());
        assertSame(failure, e.getCause());
        assertEquals(0, stage.getDistinctMap().size());
    }

    @Test
    void drainAfterDoneFails() {
        ScriptedPipelineStage.Script script = new ScriptedPipelineStage.Script()
                .page(null, null, Arrays.asList(ONE));
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.ORDERED);
        drain(stage);
        assertTrue(stage.isDone());
        ExecutionException e = assertThrows(ExecutionException.class, () -> stage.drainAsync(10, CancellationToken.NONE).get());
        assertThat(e.getCause(), instanceOf(QueryCoreException.class));
        assertEquals(1, script.drains);
    }

    @Test
    void malformedTokenFailsCreation() {
        ScriptedPipelineStage.Script script = orderedScript();
        assertThrows(MalformedContinuationTokenException.class,
                () -> DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, "{\"SourceToken\":\"U1\"}",
                        script.factory(), DistinctQueryType.ORDERED));
        String badMap = new DistinctContinuationToken("U1", "not a map token").toString();
        assertThrows(MalformedContinuationTokenException.class,
                () -> DistinctQueryPipelineStage.create(ExecutionEnvironment.COMPUTE, badMap,
                        script.factory(), DistinctQueryType.ORDERED));
        assertEquals(0, script.created);
    }

    @Test
    void factoryFailurePropagates() {
        IllegalArgumentException failure = new IllegalArgumentException("bad source token");
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                        continuationToken -> {
                            throw failure;
                        }, DistinctQueryType.ORDERED));
        assertSame(failure, thrown);
    }

    @Test
    void pageMetadataIsCarriedOver() {
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                orderedScript().factory(), DistinctQueryType.ORDERED);
        QueryPage page = drain(stage);
        assertEquals(2.5, page.getRequestCharge());
        assertEquals("activity-U1", page.getActivityId());
    }

    @Test
    void pageOfOnlyDuplicatesIsEmpty() {
        ScriptedPipelineStage.Script script = new ScriptedPipelineStage.Script()
                .page(null, "U1", Arrays.asList(ONE))
                .page("U1", "U2", Arrays.asList(ONE, ONE))
                .page("U2", null, Arrays.asList(TWO));
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.ORDERED);
        drain(stage);
        QueryPage duplicates = drain(stage);
        assertThat(duplicates.getDocuments(), empty());
        assertNotNull(duplicates.getContinuationToken());
        assertEquals(Arrays.asList(TWO), drain(stage).getDocuments());
    }

    @Test
    void defaultPageSizeFromProperties() {
        List<DocValue> documents = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            documents.add(DocNumber.of(i / 2));
        }
        QueryExecuteProperties properties = QueryExecuteProperties.newBuilder()
                .setDistinctQueryType(DistinctQueryType.ORDERED)
                .setMaxItemCount(4)
                .build();
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(properties, null,
                ListPipelineStage.factory(documents));
        QueryPage first = stage.drainAsync(CancellationToken.NONE).join();
        assertThat(first.getDocuments(), contains(DocNumber.of(0L), DocNumber.of(1L)));

        DistinctQueryPipelineStage resumed = DistinctQueryPipelineStage.create(properties, first.getContinuationToken(),
                ListPipelineStage.factory(documents));
        List<DocValue> rest = new ArrayList<>();
        while (!resumed.isDone()) {
            rest.addAll(resumed.drainAsync(CancellationToken.NONE).join().getDocuments());
        }
        assertThat(rest, contains(DocNumber.of(2L), DocNumber.of(3L), DocNumber.of(4L)));
    }

    @Test
    void unboundedSecondDrainOverList() {
        List<DocValue> documents = Arrays.asList(ONE, TWO, THREE);
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                ListPipelineStage.factory(documents), DistinctQueryType.ORDERED);
        assertThat(stage.drainAsync(1, CancellationToken.NONE).join().getDocuments(), contains(ONE));
        QueryPage rest = stage.drainAsync(Integer.MAX_VALUE, CancellationToken.NONE).join();
        assertThat(rest.getDocuments(), contains(TWO, THREE));
        assertNull(rest.getContinuationToken());
        assertTrue(stage.isDone());
    }

    @Test
    void documentsAreReturnedAsIs() {
        DocValue document = DocValueJson.parse("{\"id\":\"x\",\"tags\":[1,2]}");
        DocValue shuffled = DocValueJson.parse("{\"tags\":[1,2],\"id\":\"x\"}");
        ScriptedPipelineStage.Script script = new ScriptedPipelineStage.Script()
                .page(null, null, Arrays.asList(document, shuffled, DocObject.EMPTY));
        DistinctQueryPipelineStage stage = DistinctQueryPipelineStage.create(ExecutionEnvironment.CLIENT, null,
                script.factory(), DistinctQueryType.UNORDERED);
        List<DocValue> documents = drain(stage).getDocuments();
        assertEquals(2, documents.size());
        assertSame(document, documents.get(0));
    }
}
