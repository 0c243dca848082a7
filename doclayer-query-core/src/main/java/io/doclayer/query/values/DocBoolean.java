/*
 * DocBoolean.java
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
 * A boolean value. There are only two instances.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocBoolean extends DocValue {
    public static final DocBoolean TRUE = new DocBoolean(true);
    public static final DocBoolean FALSE = new DocBoolean(false);

    private final boolean value;

    private DocBoolean(boolean value) {
        this.value = value;
    }

    @Nonnull
    public static DocBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.BOOLEAN;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitBoolean(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocBoolean && ((DocBoolean)o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
