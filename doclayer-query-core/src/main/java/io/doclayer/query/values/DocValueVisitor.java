/*
 * DocValueVisitor.java
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

package io.doclayer.query.values;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * A visitor over the closed set of {@link DocValue} variants. Every consumer that needs to treat each variant
 * differently implements this interface, so that adding a variant breaks every such consumer at compile time.
 *
 * @param <R> result type of a visit
 * @param <A> type of the extra argument passed through a visit
 */
@API(API.Status.EXPERIMENTAL)
public interface DocValueVisitor<R, A> {
    R visitNull(@Nonnull DocNull value, A arg);

    R visitBoolean(@Nonnull DocBoolean value, A arg);

    R visitNumber(@Nonnull DocNumber value, A arg);

    R visitString(@Nonnull DocString value, A arg);

    R visitArray(@Nonnull DocArray value, A arg);

    R visitObject(@Nonnull DocObject value, A arg);

    R visitBinary(@Nonnull DocBinary value, A arg);

    R visitGuid(@Nonnull DocGuid value, A arg);
}
