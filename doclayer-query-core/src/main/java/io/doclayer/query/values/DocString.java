/*
 * DocString.java
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
import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A string value.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocString extends DocValue {
    public static final DocString EMPTY = new DocString("");

    @Nonnull
    private final String value;

    private DocString(@Nonnull String value) {
        this.value = value;
    }

    @Nonnull
    public static DocString of(@Nonnull String value) {
        return Objects.requireNonNull(value).isEmpty() ? EMPTY : new DocString(value);
    }

    @Nonnull
    public String getValue() {
        return value;
    }

    /**
     * Get the UTF-8 encoding of this string.
     * @return the encoded bytes, or {@code null} if the string holds an unpaired surrogate
     */
    @Nullable
    public byte[] toUtf8Bytes() {
        return encodeUtf8(value);
    }

    /**
     * Get the UTF-16 code units of this string, big-endian and without replacing unpaired surrogates.
     * @return two bytes per {@code char}
     */
    @Nonnull
    public byte[] toUtf16Bytes() {
        ByteBuffer buffer = ByteBuffer.allocate(value.length() * Character.BYTES);
        buffer.asCharBuffer().put(value);
        return buffer.array();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.STRING;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitString(this, arg);
    }

    /**
     * Encode a string as UTF-8, refusing input that the encoding cannot represent.
     * @param value the string to encode
     * @return the encoded bytes, or {@code null} if {@code value} holds an unpaired surrogate
     */
    @Nullable
    public static byte[] encodeUtf8(@Nonnull String value) {
        return hasUnpairedSurrogate(value) ? null : value.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean hasUnpairedSurrogate(@Nonnull String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < value.length() && Character.isLowSurrogate(value.charAt(i + 1))) {
                i++;
            } else if (Character.isSurrogate(c)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocString && ((DocString)o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
