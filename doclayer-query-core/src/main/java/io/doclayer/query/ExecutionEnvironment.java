/*
 * ExecutionEnvironment.java
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

/**
 * Where a query pipeline runs, which decides when continuation tokens are produced.
 */
@API(API.Status.EXPERIMENTAL)
public enum ExecutionEnvironment {
    /**
     * Interactive use through the client SDK. A continuation token is written into every page that can be
     * resumed from.
     */
    CLIENT,
    /**
     * Embedded use, where results are consumed as a stream. Pages never carry a continuation token; one is only
     * built when the caller asks for it.
     */
    COMPUTE
}
