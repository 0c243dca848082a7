/*
 * QueryExecuteProperties.java
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
import com.google.common.base.Preconditions;
import io.doclayer.query.distinct.DistinctQueryType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * How a query is executed. Immutable; use {@link #newBuilder()} to make one and {@link #toBuilder()} to make a
 * modified copy.
 */
@API(API.Status.EXPERIMENTAL)
public class QueryExecuteProperties {
    public static final int DEFAULT_MAX_ITEM_COUNT = 100;

    @Nonnull
    private final ExecutionEnvironment executionEnvironment;
    @Nonnull
    private final DistinctQueryType distinctQueryType;
    private final int maxItemCount;

    private QueryExecuteProperties(@Nonnull ExecutionEnvironment executionEnvironment,
                                   @Nonnull DistinctQueryType distinctQueryType,
                                   int maxItemCount) {
        this.executionEnvironment = executionEnvironment;
        this.distinctQueryType = distinctQueryType;
        this.maxItemCount = maxItemCount;
    }

    @Nonnull
    public ExecutionEnvironment getExecutionEnvironment() {
        return executionEnvironment;
    }

    @Nonnull
    public DistinctQueryType getDistinctQueryType() {
        return distinctQueryType;
    }

    /**
     * Get the most documents to request from the source in one page.
     * @return the page size limit
     */
    public int getMaxItemCount() {
        return maxItemCount;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryExecuteProperties that = (QueryExecuteProperties)o;
        return maxItemCount == that.maxItemCount
               && executionEnvironment == that.executionEnvironment
               && distinctQueryType == that.distinctQueryType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionEnvironment, distinctQueryType, maxItemCount);
    }

    @Override
    public String toString() {
        return "QueryExecuteProperties(" + executionEnvironment + ", " + distinctQueryType + ", max " + maxItemCount + ")";
    }

    /**
     * A builder for {@link QueryExecuteProperties}.
     * <pre><code>
     * QueryExecuteProperties.newBuilder().setDistinctQueryType(DistinctQueryType.ORDERED).setMaxItemCount(10).build()
     * </code></pre>
     */
    public static class Builder {
        @Nonnull
        private ExecutionEnvironment executionEnvironment = ExecutionEnvironment.CLIENT;
        @Nullable
        private DistinctQueryType distinctQueryType;
        private int maxItemCount = DEFAULT_MAX_ITEM_COUNT;

        private Builder() {
        }

        private Builder(@Nonnull QueryExecuteProperties properties) {
            this.executionEnvironment = properties.executionEnvironment;
            this.distinctQueryType = properties.distinctQueryType;
            this.maxItemCount = properties.maxItemCount;
        }

        @Nonnull
        public Builder setExecutionEnvironment(@Nonnull ExecutionEnvironment executionEnvironment) {
            this.executionEnvironment = Objects.requireNonNull(executionEnvironment);
            return this;
        }

        @Nonnull
        public Builder setDistinctQueryType(@Nonnull DistinctQueryType distinctQueryType) {
            this.distinctQueryType = Objects.requireNonNull(distinctQueryType);
            return this;
        }

        @Nonnull
        public Builder setMaxItemCount(int maxItemCount) {
            Preconditions.checkArgument(maxItemCount > 0, "max item count must be positive");
            this.maxItemCount = maxItemCount;
            return this;
        }

        @Nonnull
        public QueryExecuteProperties build() {
            Preconditions.checkState(distinctQueryType != null, "distinct query type must be set");
            return new QueryExecuteProperties(executionEnvironment, distinctQueryType, maxItemCount);
        }
    }
}
