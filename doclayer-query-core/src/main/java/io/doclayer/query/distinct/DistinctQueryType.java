/*
 * DistinctQueryType.java
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

/**
 * Whether a DISTINCT query is paired with an ORDER BY on the same expression. Only ordered DISTINCT queries can
 * be resumed from a continuation, since only then are duplicates guaranteed to be adjacent in the source.
 */
@API(API.Status.EXPERIMENTAL)
public enum DistinctQueryType {
    UNORDERED,
    ORDERED
}
