/*
 * QueryPipelineStageFactory.java
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
import javax.annotation.Nullable;

/**
 * Creates a {@link QueryPipelineStage}, either from the start or resumed from a continuation token the stage
 * returned earlier.
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface QueryPipelineStageFactory {
    @Nonnull
    QueryPipelineStage create(@Nullable String continuationToken);
}
