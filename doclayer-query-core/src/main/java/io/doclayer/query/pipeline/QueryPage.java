/*
 * QueryPage.java
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
import com.google.common.collect.ImmutableList;
import io.doclayer.query.values.DocValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * One batch of documents returned by a {@link QueryPipelineStage}.
 *
 * <p>
 * A page without a continuation token is the last page of its stage. A stage that can never be resumed still
 * returns continuation-less pages, and says why in {@link #getDisallowContinuationTokenMessage()}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class QueryPage {
    @Nonnull
    private final List<DocValue> documents;
    private final double requestCharge;
    @Nullable
    private final String activityId;
    @Nullable
    private final String continuationToken;
    @Nullable
    private final String disallowContinuationTokenMessage;

    private QueryPage(@Nonnull Builder builder) {
        this.documents = builder.documents.build();
        this.requestCharge = builder.requestCharge;
        this.activityId = builder.activityId;
        this.continuationToken = builder.continuationToken;
        this.disallowContinuationTokenMessage = builder.disallowContinuationTokenMessage;
    }

    @Nonnull
    public List<DocValue> getDocuments() {
        return documents;
    }

    public double getRequestCharge() {
        return requestCharge;
    }

    @Nullable
    public String getActivityId() {
        return activityId;
    }

    /**
     * Get the token to resume from after this page.
     * @return the continuation token, or {@code null} if there is nothing to resume
     */
    @Nullable
    public String getContinuationToken() {
        return continuationToken;
    }

    @Nullable
    public String getDisallowContinuationTokenMessage() {
        return disallowContinuationTokenMessage;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "QueryPage{documents=" + documents.size()
               + ", requestCharge=" + requestCharge
               + ", activityId=" + activityId
               + ", continuationToken=" + continuationToken + "}";
    }

    /**
     * Builder for {@link QueryPage}.
     */
    public static class Builder {
        @Nonnull
        private final ImmutableList.Builder<DocValue> documents = ImmutableList.builder();
        private double requestCharge;
        @Nullable
        private String activityId;
        @Nullable
        private String continuationToken;
        @Nullable
        private String disallowContinuationTokenMessage;

        private Builder() {
        }

        @Nonnull
        public Builder addDocument(@Nonnull DocValue document) {
            documents.add(document);
            return this;
        }

        @Nonnull
        public Builder addDocuments(@Nonnull Iterable<? extends DocValue> documents) {
            this.documents.addAll(documents);
            return this;
        }

        @Nonnull
        public Builder setRequestCharge(double requestCharge) {
            this.requestCharge = requestCharge;
            return this;
        }

        @Nonnull
        public Builder setActivityId(@Nullable String activityId) {
            this.activityId = activityId;
            return this;
        }

        @Nonnull
        public Builder setContinuationToken(@Nullable String continuationToken) {
            this.continuationToken = continuationToken;
            return this;
        }

        @Nonnull
        public Builder setDisallowContinuationTokenMessage(@Nullable String disallowContinuationTokenMessage) {
            this.disallowContinuationTokenMessage = disallowContinuationTokenMessage;
            return this;
        }

        @Nonnull
        public QueryPage build() {
            return new QueryPage(this);
        }
    }
}
