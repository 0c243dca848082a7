/*
 * DocBinary.java
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
import java.util.Arrays;

/**
 * An opaque blob of bytes.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocBinary extends DocValue {
    @Nonnull
    private final byte[] bytes;

    private DocBinary(@Nonnull byte[] bytes) {
        this.bytes = bytes;
    }

    @Nonnull
    public static DocBinary of(@Nonnull byte[] bytes) {
        return new DocBinary(bytes.clone());
    }

    /**
     * Get a copy of the bytes of this blob.
     * @return this blob's bytes
     */
    @Nonnull
    public byte[] getBytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.BINARY;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitBinary(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocBinary && Arrays.equals(((DocBinary)o).bytes, bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
