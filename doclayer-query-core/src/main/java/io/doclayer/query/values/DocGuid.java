/*
 * DocGuid.java
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
import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * A globally unique identifier.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocGuid extends DocValue {
    public static final int BYTES = 16;

    @Nonnull
    private final UUID value;

    private DocGuid(@Nonnull UUID value) {
        this.value = value;
    }

    @Nonnull
    public static DocGuid of(@Nonnull UUID value) {
        return new DocGuid(value);
    }

    @Nonnull
    public UUID getValue() {
        return value;
    }

    /**
     * Get the 16-byte binary form of this guid: the most significant bits followed by the least significant bits,
     * both big-endian.
     * @return the guid's bytes
     */
    @Nonnull
    public byte[] toByteArray() {
        return ByteBuffer.allocate(BYTES)
                .putLong(value.getMostSignificantBits())
                .putLong(value.getLeastSignificantBits())
                .array();
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.GUID;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitGuid(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocGuid && ((DocGuid)o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
