/*
 * DocArray.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of values. Two arrays are equal when they have the same elements in the same order.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocArray extends DocValue implements Iterable<DocValue> {
    public static final DocArray EMPTY = new DocArray(ImmutableList.of());

    @Nonnull
    private final ImmutableList<DocValue> elements;

    private DocArray(@Nonnull ImmutableList<DocValue> elements) {
        this.elements = elements;
    }

    @Nonnull
    public static DocArray of(@Nonnull DocValue... elements) {
        return of(ImmutableList.copyOf(elements));
    }

    @Nonnull
    public static DocArray of(@Nonnull List<? extends DocValue> elements) {
        return elements.isEmpty() ? EMPTY : new DocArray(ImmutableList.copyOf(elements));
    }

    @Nonnull
    public List<DocValue> getElements() {
        return elements;
    }

    @Nonnull
    public DocValue get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Nonnull
    @Override
    public Iterator<DocValue> iterator() {
        return elements.iterator();
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.ARRAY;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitArray(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocArray && ((DocArray)o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
