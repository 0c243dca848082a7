/*
 * DocValue.java
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
 * A node of a semi-structured document: one of null, boolean, number, string, array, object, binary or guid.
 *
 * <p>
 * The set of subclasses is closed (the constructor is package-private). Code that needs to handle each variant
 * should do so through {@link #accept(DocValueVisitor, Object)} rather than {@code instanceof} chains.
 * A missing value ("undefined") has no {@code DocValue}; it is represented by a {@code null} reference.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class DocValue {
    DocValue() {
    }

    @Nonnull
    public abstract DocValueType getType();

    public abstract <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg);

    /**
     * Returns the compact JSON text of this value.
     * @return this value as JSON
     */
    @Override
    public String toString() {
        return DocValueJson.toJson(this);
    }
}
