/*
 * UInt128.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * An immutable unsigned 128-bit integer, stored as two 64-bit halves.
 * The byte form is 16 bytes, little-endian (low half first).
 */
@API(API.Status.UNSTABLE)
public final class UInt128 implements Comparable<UInt128> {
    /** Number of bytes in the serialized form. */
    public static final int BYTES = 16;

    @Nonnull
    public static final UInt128 ZERO = new UInt128(0L, 0L);

    private final long low;
    private final long high;

    private UInt128(long low, long high) {
        this.low = low;
        this.high = high;
    }

    @Nonnull
    public static UInt128 create(long low, long high) {
        if (low == 0L && high == 0L) {
            return ZERO;
        }
        return new UInt128(low, high);
    }

    /**
     * Read a value from the first 16 bytes of the given array.
     *
     * @param bytes at least 16 bytes, little-endian
     * @return the value
     */
    @Nonnull
    public static UInt128 fromByteArray(@Nonnull byte[] bytes) {
        Preconditions.checkArgument(bytes.length >= BYTES, "UInt128 requires %s bytes, got %s", BYTES, bytes.length);
        ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, BYTES).order(ByteOrder.LITTLE_ENDIAN);
        long low = buffer.getLong();
        long high = buffer.getLong();
        return create(low, high);
    }

    @Nonnull
    public byte[] toByteArray() {
        return ByteBuffer.allocate(BYTES).order(ByteOrder.LITTLE_ENDIAN)
                .putLong(low)
                .putLong(high)
                .array();
    }

    public long getLow() {
        return low;
    }

    public long getHigh() {
        return high;
    }

    public boolean isZero() {
        return low == 0L && high == 0L;
    }

    /**
     * Add an unsigned amount, wrapping around at 2<sup>128</sup>.
     *
     * @param addend a non-negative amount to add
     * @return the sum
     */
    @Nonnull
    public UInt128 add(long addend) {
        Preconditions.checkArgument(addend >= 0, "addend must not be negative");
        long newLow = low + addend;
        long carry = Long.compareUnsigned(newLow, low) < 0 ? 1L : 0L;
        return create(newLow, high + carry);
    }

    @Nonnull
    public UInt128 xor(@Nonnull UInt128 other) {
        return create(low ^ other.low, high ^ other.high);
    }

    @Override
    public int compareTo(@Nonnull UInt128 other) {
        int highComparison = Long.compareUnsigned(high, other.high);
        return highComparison != 0 ? highComparison : Long.compareUnsigned(low, other.low);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UInt128 that = (UInt128)o;
        return low == that.low && high == that.high;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(low) * 31 + Long.hashCode(high);
    }

    @Override
    public String toString() {
        return String.format("0x%016x%016x", high, low);
    }
}
