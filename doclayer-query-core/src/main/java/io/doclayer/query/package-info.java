/*
 * package-info.java
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

/**
 * Client-side execution of DISTINCT queries over a paged, resumable document source.
 *
 * <p>
 * The values being deduplicated are in {@link io.doclayer.query.values}. The paged source contract is in
 * {@link io.doclayer.query.pipeline}, and the DISTINCT stage with its hashing and continuation handling is in
 * {@link io.doclayer.query.distinct}.
 * </p>
 */
package io.doclayer.query;
