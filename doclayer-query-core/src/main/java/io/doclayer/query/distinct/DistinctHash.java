/*
 * DistinctHash.java
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
import io.doclayer.hash.MurmurHash3;
import io.doclayer.hash.UInt128;
import io.doclayer.query.values.DocArray;
import io.doclayer.query.values.DocBinary;
import io.doclayer.query.values.DocBoolean;
import io.doclayer.query.values.DocGuid;
import io.doclayer.query.values.DocNull;
import io.doclayer.query.values.DocNumber;
import io.doclayer.query.values.DocObject;
import io.doclayer.query.values.DocString;
import io.doclayer.query.values.DocValue;
import io.doclayer.query.values.DocValueVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Structural 128-bit hash of {@link DocValue}s, used as the deduplication key of DISTINCT queries.
 *
 * <p>
 * Each variant mixes in its own seed before its content, so that values of different variants with the same
 * content do not collide. Numbers are hashed through their canonical {@code double} so that {@code 5} and
 * {@code 5.0} hash the same. Arrays are sensitive to element order. Objects are not sensitive to property order:
 * each property is hashed on its own and the results are combined with XOR.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class DistinctHash {
    static final UInt128 ROOT_SEED = UInt128.create(0x6a5d39eae116586dL, 0x1f7c1c2b5a0e4f83L);
    static final UInt128 NULL_SEED = UInt128.create(0x8e0f4c1b7d2a5c33L, 0x3b6e2f9a14c7d850L);
    static final UInt128 FALSE_SEED = UInt128.create(0x2d9b7e4f06a3c815L, 0x90c4a7d23e5f1b6eL);
    static final UInt128 TRUE_SEED = UInt128.create(0xc37a1e05b9f24d6aL, 0x47e8b2d1f0936c2fL);
    static final UInt128 NUMBER_SEED = UInt128.create(0x5f28c9a3e71d0b4eL, 0xd1364f8b2ac0e957L);
    static final UInt128 STRING_SEED = UInt128.create(0xa46e03d7c82f195bL, 0x6c0bd5e93f7a2481L);
    static final UInt128 ARRAY_SEED = UInt128.create(0x1b94f6c25e0a73d8L, 0xe52a80c4d6b91f37L);
    static final UInt128 OBJECT_SEED = UInt128.create(0x7cd2058e9b3fa641L, 0x2fa9e1c6570d38b4L);
    static final UInt128 ARRAY_INDEX_SEED = UInt128.create(0xe8317a4d0c5b92f6L, 0x84d6f03b1e2ac759L);
    static final UInt128 PROPERTY_NAME_SEED = UInt128.create(0x36b5d8f1a4092ec7L, 0xb71c4e0a9d53f628L);
    static final UInt128 BINARY_SEED = UInt128.create(0xf40e6b2c8d7a1395L, 0x58a3c9f71b0e4d2aL);
    static final UInt128 GUID_SEED = UInt128.create(0x09c1f7e3b56d48a2L, 0xca7f215e83b6d90cL);
    static final UInt128 UTF16_STRING_SEED = UInt128.create(0x4b2e97d1c6f0a853L, 0x1d83f5a20e7bc469L);

    private static final HashVisitor VISITOR = new HashVisitor();

    private DistinctHash() {
    }

    /**
     * Hash a value with the root seed.
     * @param value the value to hash, or {@code null} for a missing value
     * @return the structural hash of the value
     */
    @Nonnull
    public static UInt128 hash(@Nullable DocValue value) {
        return hash(value, ROOT_SEED);
    }

    /**
     * Hash a value with the given seed. A missing value leaves the seed unchanged.
     * @param value the value to hash, or {@code null} for a missing value
     * @param seed the seed to hash with
     * @return the structural hash of the value
     */
    @Nonnull
    public static UInt128 hash(@Nullable DocValue value, @Nonnull UInt128 seed) {
        if (value == null) {
            return seed;
        }
        return value.accept(VISITOR, seed);
    }

    // Strings UTF-8 cannot encode are hashed over their UTF-16 code units under a seed of their own.
    @Nonnull
    private static UInt128 hashString(@Nonnull String value, @Nonnull UInt128 seed) {
        byte[] utf8 = DocString.encodeUtf8(value);
        if (utf8 != null) {
            return MurmurHash3.hash128(utf8, seed);
        }
        return MurmurHash3.hash128(DocString.of(value).toUtf16Bytes(), MurmurHash3.hash128(UTF16_STRING_SEED, seed));
    }

    private static class HashVisitor implements DocValueVisitor<UInt128, UInt128> {
        @Override
        public UInt128 visitNull(@Nonnull DocNull value, UInt128 seed) {
            return MurmurHash3.hash128(NULL_SEED, seed);
        }

        @Override
        public UInt128 visitBoolean(@Nonnull DocBoolean value, UInt128 seed) {
            return MurmurHash3.hash128(value.getValue() ? TRUE_SEED : FALSE_SEED, seed);
        }

        @Override
        public UInt128 visitNumber(@Nonnull DocNumber value, UInt128 seed) {
            UInt128 hash = MurmurHash3.hash128(NUMBER_SEED, seed);
            return MurmurHash3.hash128(Double.doubleToLongBits(value.canonicalDouble()), hash);
        }

        @Override
        public UInt128 visitString(@Nonnull DocString value, UInt128 seed) {
            return hashString(value.getValue(), MurmurHash3.hash128(STRING_SEED, seed));
        }

        @Override
        public UInt128 visitArray(@Nonnull DocArray value, UInt128 seed) {
            UInt128 hash = MurmurHash3.hash128(ARRAY_SEED, seed);
            int index = 0;
            for (DocValue element : value) {
                UInt128 elementHash = element.accept(this, ARRAY_INDEX_SEED.add(index));
                hash = MurmurHash3.hash128(elementHash, hash);
                index++;
            }
            return hash;
        }

        @Override
        public UInt128 visitObject(@Nonnull DocObject value, UInt128 seed) {
            UInt128 hash = MurmurHash3.hash128(OBJECT_SEED, seed);
            UInt128 properties = UInt128.ZERO;
            for (Map.Entry<String, DocValue> entry : value.getProperties().entrySet()) {
                UInt128 nameHash = MurmurHash3.hash128(STRING_SEED, PROPERTY_NAME_SEED);
                nameHash = hashString(entry.getKey(), nameHash);
                properties = properties.xor(entry.getValue().accept(this, nameHash));
            }
            if (!properties.isZero()) {
                hash = MurmurHash3.hash128(properties, hash);
            }
            return hash;
        }

        @Override
        public UInt128 visitBinary(@Nonnull DocBinary value, UInt128 seed) {
            UInt128 hash = MurmurHash3.hash128(BINARY_SEED, seed);
            return MurmurHash3.hash128(value.getBytes(), hash);
        }

        @Override
        public UInt128 visitGuid(@Nonnull DocGuid value, UInt128 seed) {
            UInt128 hash = MurmurHash3.hash128(GUID_SEED, seed);
            return MurmurHash3.hash128(value.toByteArray(), hash);
        }
    }
}
