/*
 * DocNumber.java
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
 * A number, held either as a 64-bit integer or as a 64-bit floating point value.
 *
 * <p>
 * Two numbers are equal when they denote the same numeric value, whichever representation they use, so
 * {@code 5} equals {@code 5.0} and {@code -0.0} equals {@code 0.0}. All {@code NaN}s are equal to each other.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class DocNumber extends DocValue {
    private final boolean integral;
    private final long longValue;
    private final double doubleValue;

    private DocNumber(boolean integral, long longValue, double doubleValue) {
        this.integral = integral;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
    }

    @Nonnull
    public static DocNumber of(long value) {
        return new DocNumber(true, value, 0.0);
    }

    @Nonnull
    public static DocNumber of(double value) {
        return new DocNumber(false, 0L, value);
    }

    /**
     * Whether this number was created from an integer.
     * @return {@code true} if this number holds a {@code long}
     */
    public boolean isIntegral() {
        return integral;
    }

    public long longValue() {
        return integral ? longValue : (long)doubleValue;
    }

    public double doubleValue() {
        return integral ? (double)longValue : doubleValue;
    }

    /**
     * Get this number as a {@code double}, with {@code -0.0} folded into {@code 0.0} and every {@code NaN}
     * folded into {@link Double#NaN}. Equal numbers have identical canonical bit patterns, except for
     * integers too large to be represented exactly by a {@code double}.
     * @return the canonical {@code double} form of this number
     */
    public double canonicalDouble() {
        double value = doubleValue();
        if (value == 0.0) {
            return 0.0;
        }
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        return value;
    }

    /**
     * Get an exact key for this number: a canonical {@link Double} when the number is exactly representable as a
     * {@code double}, and a {@link Long} otherwise. Two numbers are equal if and only if their exact keys are equal.
     * @return a boxed key that identifies this number's value exactly
     */
    @Nonnull
    public Number exactKey() {
        if (integral && !fitsDouble(longValue)) {
            return longValue;
        }
        return canonicalDouble();
    }

    private static boolean fitsDouble(long value) {
        double asDouble = (double)value;
        // (long) of 2^63 saturates to Long.MAX_VALUE, which is not itself a double
        return asDouble != 0x1p63 && (long)asDouble == value;
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.NUMBER;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitNumber(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocNumber)) {
            return false;
        }
        return exactKey().equals(((DocNumber)o).exactKey());
    }

    @Override
    public int hashCode() {
        return exactKey().hashCode();
    }
}
