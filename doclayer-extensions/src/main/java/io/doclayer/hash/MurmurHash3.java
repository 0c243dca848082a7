/*
 * MurmurHash3.java
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

package io.doclayer.hash;

import com.apple.foundationdb.annotation.API;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import javax.annotation.Nonnull;

/**
 * Seeded 128-bit MurmurHash3 (x64 variant) on top of Guava's {@link Hashing#murmur3_128()}.
 * <p>
 * Guava only accepts a 32-bit seed, so the full 128-bit seed is fed through the hash ahead of the payload.
 * Two calls with different seeds or different payloads therefore disagree with the same probability as two
 * unrelated inputs.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class MurmurHash3 {
    @Nonnull
    private static final HashFunction MURMUR3_128 = Hashing.murmur3_128();

    private MurmurHash3() {
    }

    @Nonnull
    public static UInt128 hash128(@Nonnull byte[] bytes, @Nonnull UInt128 seed) {
        return finish(seeded(seed, bytes.length).putBytes(bytes));
    }

    @Nonnull
    public static UInt128 hash128(@Nonnull UInt128 value, @Nonnull UInt128 seed) {
        return finish(seeded(seed, UInt128.BYTES)
                .putLong(value.getLow())
                .putLong(value.getHigh()));
    }

    @Nonnull
    public static UInt128 hash128(long value, @Nonnull UInt128 seed) {
        return finish(seeded(seed, Long.BYTES).putLong(value));
    }

    @Nonnull
    private static Hasher seeded(@Nonnull UInt128 seed, int payloadLength) {
        return MURMUR3_128.newHasher(UInt128.BYTES + payloadLength)
                .putLong(seed.getLow())
                .putLong(seed.getHigh());
    }

    @Nonnull
    private static UInt128 finish(@Nonnull Hasher hasher) {
        return UInt128.fromByteArray(hasher.hash().asBytes());
    }
}
