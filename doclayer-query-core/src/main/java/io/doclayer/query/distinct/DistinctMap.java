/*
 * DistinctMap.java
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
import com.apple.foundationdb.tuple.Tuple;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import io.doclayer.hash.UInt128;
import io.doclayer.query.MalformedContinuationTokenException;
import io.doclayer.query.logging.LogMessageKeys;
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
import io.doclayer.util.ByteArrayUtil;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The set of values a DISTINCT query has already returned.
 *
 * <p>
 * Values are partitioned by variant so that most of them can be remembered without hashing and without a false
 * positive. Numbers are stored exactly. Strings of up to 16 UTF-8 bytes are zero-padded to 4, 8 or 16 bytes
 * and stored as the little-endian integer those bytes spell. Longer strings, binaries, guids, arrays and objects
 * are stored as their {@link DistinctHash}. The values {@code null}, {@code true}, {@code false}, the empty
 * string, the empty array, the empty object and a missing value each take a single flag.
 * </p>
 *
 * <p>
 * The whole state can be written out with {@link #getContinuationToken()} and read back with
 * {@link #create(DistinctQueryType, String)}. The token is a packed {@link Tuple} of field names and values,
 * encoded as base64.
 * </p>
 *
 * <p>
 * In {@link DistinctQueryType#ORDERED} mode, duplicates arrive next to each other, so the map also remembers the
 * hash of the last value added and {@link #add(DocValue)} returns the value's hash. In
 * {@link DistinctQueryType#UNORDERED} mode the returned hash is always {@link UInt128#ZERO}.
 * </p>
 *
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class DistinctMap {
    static final String NUMBERS = "Numbers";
    static final String STRINGS_LENGTH_4 = "StringsLength4";
    static final String STRINGS_LENGTH_8 = "StringsLength8";
    static final String STRINGS_LENGTH_16 = "StringsLength16";
    static final String STRINGS_LENGTH_16_PLUS = "StringsLength16+";
    static final String ARRAYS = "Arrays";
    static final String OBJECT = "Object";
    static final String SIMPLE_VALUES = "SimpleValues";

    static final List<String> FIELD_NAMES = Arrays.asList(NUMBERS, STRINGS_LENGTH_4, STRINGS_LENGTH_8,
            STRINGS_LENGTH_16, STRINGS_LENGTH_16_PLUS, ARRAYS, OBJECT, SIMPLE_VALUES);

    static final String NO_SIMPLE_VALUES = "None";
    private static final String SIMPLE_VALUE_SEPARATOR = ", ";

    /**
     * The longest UTF-8 string, in bytes, that is stored exactly.
     */
    public static final int MAX_EXACT_STRING_LENGTH = 16;

    @Nonnull
    private final DistinctQueryType distinctQueryType;
    @Nonnull
    private final Set<Number> numbers;
    @Nonnull
    private final Set<Integer> stringsLength4;
    @Nonnull
    private final Set<Long> stringsLength8;
    @Nonnull
    private final Set<UInt128> stringsLength16;
    @Nonnull
    private final Set<UInt128> stringsLength16Plus;
    @Nonnull
    private final Set<UInt128> arrays;
    @Nonnull
    private final Set<UInt128> objects;
    @Nonnull
    private final EnumSet<SimpleValue> simpleValues;
    @Nullable
    private UInt128 lastHash;

    private DistinctMap(@Nonnull DistinctQueryType distinctQueryType) {
        this.distinctQueryType = distinctQueryType;
        this.numbers = new LinkedHashSet<>();
        this.stringsLength4 = new LinkedHashSet<>();
        this.stringsLength8 = new LinkedHashSet<>();
        this.stringsLength16 = new LinkedHashSet<>();
        this.stringsLength16Plus = new LinkedHashSet<>();
        this.arrays = new LinkedHashSet<>();
        this.objects = new LinkedHashSet<>();
        this.simpleValues = EnumSet.noneOf(SimpleValue.class);
    }

    /**
     * Create a map, either empty or restored from a continuation token.
     * @param distinctQueryType whether the query is ordered
     * @param continuationToken a token from {@link #getContinuationToken()}, or {@code null} to start empty
     * @return a new map
     * @throws MalformedContinuationTokenException if the token is not one this class writes
     */
    @Nonnull
    public static DistinctMap create(@Nonnull DistinctQueryType distinctQueryType, @Nullable String continuationToken) {
        DistinctMap map = new DistinctMap(Objects.requireNonNull(distinctQueryType));
        if (continuationToken != null) {
            map.restore(continuationToken);
        }
        return map;
    }

    @Nonnull
    public DistinctQueryType getDistinctQueryType() {
        return distinctQueryType;
    }

    /**
     * Add a value to the map.
     * @param value the value to add, or {@code null} for a missing value
     * @return whether the value was not yet in the map, with the value's hash in ordered mode
     */
    @Nonnull
    public AddResult add(@Nullable DocValue value) {
        if (distinctQueryType == DistinctQueryType.ORDERED) {
            UInt128 hash = DistinctHash.hash(value);
            if (hash.equals(lastHash)) {
                return new AddResult(false, hash);
            }
            lastHash = hash;
            return new AddResult(addValue(value), hash);
        }
        return new AddResult(addValue(value), UInt128.ZERO);
    }

    private boolean addValue(@Nullable DocValue value) {
        if (value == null) {
            return simpleValues.add(SimpleValue.UNDEFINED);
        }
        return value.accept(AddVisitor.INSTANCE, this);
    }

    private boolean addString(@Nonnull DocString value) {
        if (value.isEmpty()) {
            return simpleValues.add(SimpleValue.EMPTY_STRING);
        }
        byte[] bytes = value.toUtf8Bytes();
        // Zero padding cannot tell a trailing NUL apart from a shorter string.
        if (bytes == null || bytes.length > MAX_EXACT_STRING_LENGTH || bytes[bytes.length - 1] == 0) {
            return stringsLength16Plus.add(DistinctHash.hash(value));
        }
        int length = bytes.length;
        if (length <= Integer.BYTES) {
            return stringsLength4.add(padded(bytes, Integer.BYTES).getInt());
        } else if (length <= Long.BYTES) {
            return stringsLength8.add(padded(bytes, Long.BYTES).getLong());
        } else {
            return stringsLength16.add(UInt128.fromByteArray(Arrays.copyOf(bytes, UInt128.BYTES)));
        }
    }

    @Nonnull
    private static ByteBuffer padded(@Nonnull byte[] bytes, int width) {
        return ByteBuffer.wrap(Arrays.copyOf(bytes, width)).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Get the number of entries in the map. Each flag for a simple value counts as one entry.
     * @return the number of distinct values added so far
     */
    public int size() {
        return numbers.size() + stringsLength4.size() + stringsLength8.size() + stringsLength16.size()
               + stringsLength16Plus.size() + arrays.size() + objects.size() + simpleValues.size();
    }

    /**
     * Serialize the contents of this map.
     * @return a token that {@link #create(DistinctQueryType, String)} turns back into an equivalent map
     */
    @Nonnull
    public String getContinuationToken() {
        Tuple tuple = Tuple.from(
                NUMBERS, new ArrayList<Object>(numbers),
                STRINGS_LENGTH_4, toLongs(stringsLength4),
                STRINGS_LENGTH_8, new ArrayList<Object>(stringsLength8),
                STRINGS_LENGTH_16, toBytes(stringsLength16),
                STRINGS_LENGTH_16_PLUS, toBytes(stringsLength16Plus),
                ARRAYS, toBytes(arrays),
                OBJECT, toBytes(objects),
                SIMPLE_VALUES, simpleValuesName());
        return Base64.getEncoder().encodeToString(tuple.pack());
    }

    @Nonnull
    private static List<Object> toLongs(@Nonnull Collection<Integer> values) {
        List<Object> longs = new ArrayList<>(values.size());
        for (Integer value : values) {
            longs.add(value.longValue());
        }
        return longs;
    }

    @Nonnull
    private static List<Object> toBytes(@Nonnull Collection<UInt128> values) {
        List<Object> bytes = new ArrayList<>(values.size());
        for (UInt128 value : values) {
            bytes.add(value.toByteArray());
        }
        return bytes;
    }

    @Nonnull
    private String simpleValuesName() {
        if (simpleValues.isEmpty()) {
            return NO_SIMPLE_VALUES;
        }
        List<String> names = new ArrayList<>(simpleValues.size());
        for (SimpleValue simpleValue : simpleValues) {
            names.add(simpleValue.getTokenName());
        }
        return Joiner.on(SIMPLE_VALUE_SEPARATOR).join(names);
    }

    private void restore(@Nonnull String continuationToken) {
        final byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(continuationToken);
        } catch (IllegalArgumentException e) {
            throw new MalformedContinuationTokenException("distinct map continuation is not base64", e)
                    .addLogInfo(LogMessageKeys.RAW_TOKEN, continuationToken);
        }
        final Tuple tuple;
        try {
            tuple = Tuple.fromBytes(bytes);
        } catch (IllegalArgumentException | IllegalStateException | IndexOutOfBoundsException e) {
            throw new MalformedContinuationTokenException("distinct map continuation is not a tuple", e)
                    .addLogInfo(LogMessageKeys.RAW_TOKEN, continuationToken)
                    .addLogInfo(LogMessageKeys.RAW_BYTES, ByteArrayUtil.loggable(bytes));
        }
        Map<String, Object> fields = readFields(tuple, continuationToken);
        for (Object element : readList(fields, NUMBERS, continuationToken)) {
            if (element instanceof Double) {
                numbers.add(DocNumber.of((Double)element).exactKey());
            } else if (element instanceof Long) {
                numbers.add(DocNumber.of((Long)element).exactKey());
            } else {
                throw wrongType(NUMBERS, "number", element, continuationToken);
            }
        }
        for (Object element : readList(fields, STRINGS_LENGTH_4, continuationToken)) {
            if (!(element instanceof Long) || (Long)element != ((Long)element).intValue()) {
                throw wrongType(STRINGS_LENGTH_4, "32-bit integer", element, continuationToken);
            }
            stringsLength4.add(((Long)element).intValue());
        }
        for (Object element : readList(fields, STRINGS_LENGTH_8, continuationToken)) {
            if (!(element instanceof Long)) {
                throw wrongType(STRINGS_LENGTH_8, "64-bit integer", element, continuationToken);
            }
            stringsLength8.add((Long)element);
        }
        readHashes(fields, STRINGS_LENGTH_16, stringsLength16, continuationToken);
        readHashes(fields, STRINGS_LENGTH_16_PLUS, stringsLength16Plus, continuationToken);
        readHashes(fields, ARRAYS, arrays, continuationToken);
        readHashes(fields, OBJECT, objects, continuationToken);
        Object simple = fields.get(SIMPLE_VALUES);
        if (!(simple instanceof String)) {
            throw wrongType(SIMPLE_VALUES, "string", simple, continuationToken);
        }
        readSimpleValues((String)simple, continuationToken);
    }

    @Nonnull
    private static Map<String, Object> readFields(@Nonnull Tuple tuple, @Nonnull String continuationToken) {
        if (tuple.size() != FIELD_NAMES.size() * 2) {
            throw new MalformedContinuationTokenException("distinct map continuation has the wrong number of fields",
                    LogMessageKeys.RAW_TOKEN, continuationToken,
                    LogMessageKeys.FIELD_COUNT, tuple.size());
        }
        Map<String, Object> fields = new HashMap<>();
        for (int i = 0; i < tuple.size(); i += 2) {
            Object name = tuple.get(i);
            if (!(name instanceof String) || !FIELD_NAMES.contains(name)) {
                throw new MalformedContinuationTokenException("distinct map continuation has an unknown field",
                        LogMessageKeys.RAW_TOKEN, continuationToken,
                        LogMessageKeys.FIELD_NAME, name);
            }
            if (fields.containsKey(name)) {
                throw new MalformedContinuationTokenException("distinct map continuation repeats a field",
                        LogMessageKeys.RAW_TOKEN, continuationToken,
                        LogMessageKeys.FIELD_NAME, name);
            }
            fields.put((String)name, tuple.get(i + 1));
        }
        return fields;
    }

    @Nonnull
    private static List<?> readList(@Nonnull Map<String, Object> fields, @Nonnull String fieldName,
                                    @Nonnull String continuationToken) {
        Object value = fields.get(fieldName);
        if (!(value instanceof List<?>)) {
            throw wrongType(fieldName, "array", value, continuationToken);
        }
        return (List<?>)value;
    }

    private static void readHashes(@Nonnull Map<String, Object> fields, @Nonnull String fieldName,
                                   @Nonnull Set<UInt128> into, @Nonnull String continuationToken) {
        for (Object element : readList(fields, fieldName, continuationToken)) {
            if (!(element instanceof byte[]) || ((byte[])element).length != UInt128.BYTES) {
                throw wrongType(fieldName, "16-byte binary", element, continuationToken);
            }
            into.add(UInt128.fromByteArray((byte[])element));
        }
    }

    private void readSimpleValues(@Nonnull String names, @Nonnull String continuationToken) {
        if (NO_SIMPLE_VALUES.equals(names)) {
            return;
        }
        for (String name : Splitter.on(',').trimResults().split(names)) {
            SimpleValue simpleValue = SimpleValue.fromTokenName(name);
            if (simpleValue == null) {
                throw new MalformedContinuationTokenException("distinct map continuation has an unknown simple value",
                        LogMessageKeys.RAW_TOKEN, continuationToken,
                        LogMessageKeys.FIELD_NAME, SIMPLE_VALUES,
                        LogMessageKeys.SIMPLE_VALUE, name);
            }
            simpleValues.add(simpleValue);
        }
    }

    @Nonnull
    private static MalformedContinuationTokenException wrongType(@Nonnull String fieldName, @Nonnull String expected,
                                                                 @Nullable Object actual, @Nonnull String continuationToken) {
        return new MalformedContinuationTokenException("distinct map continuation field has the wrong type",
                LogMessageKeys.RAW_TOKEN, continuationToken,
                LogMessageKeys.FIELD_NAME, fieldName,
                LogMessageKeys.EXPECTED_TYPE, expected,
                LogMessageKeys.ACTUAL_TYPE, actual == null ? "null" : actual.getClass().getSimpleName());
    }

    /**
     * Result of {@link #add(DocValue)}.
     */
    public static final class AddResult {
        private final boolean newlyAdded;
        @Nonnull
        private final UInt128 hash;

        AddResult(boolean newlyAdded, @Nonnull UInt128 hash) {
            this.newlyAdded = newlyAdded;
            this.hash = hash;
        }

        /**
         * Whether the value had not been added before.
         * @return {@code true} the first time a value is added
         */
        public boolean isNewlyAdded() {
            return newlyAdded;
        }

        /**
         * The hash of the value in ordered mode, {@link UInt128#ZERO} in unordered mode.
         * @return the value's hash
         */
        @Nonnull
        public UInt128 getHash() {
            return hash;
        }

        @Override
        public String toString() {
            return "AddResult{newlyAdded=" + newlyAdded + ", hash=" + hash + "}";
        }
    }

    /**
     * Values that are tracked with a single flag.
     */
    enum SimpleValue {
        UNDEFINED("Undefined"),
        NULL("Null"),
        FALSE("False"),
        TRUE("True"),
        EMPTY_STRING("EmptyString"),
        EMPTY_ARRAY("EmptyArray"),
        EMPTY_OBJECT("EmptyObject");

        @Nonnull
        private final String tokenName;

        SimpleValue(@Nonnull String tokenName) {
            this.tokenName = tokenName;
        }

        @Nonnull
        String getTokenName() {
            return tokenName;
        }

        @Nullable
        static SimpleValue fromTokenName(@Nonnull String tokenName) {
            for (SimpleValue simpleValue : values()) {
                if (simpleValue.tokenName.equals(tokenName)) {
                    return simpleValue;
                }
            }
            return null;
        }
    }

    private static class AddVisitor implements DocValueVisitor<Boolean, DistinctMap> {
        private static final AddVisitor INSTANCE = new AddVisitor();

        @Override
        public Boolean visitNull(@Nonnull DocNull value, DistinctMap map) {
            return map.simpleValues.add(SimpleValue.NULL);
        }

        @Override
        public Boolean visitBoolean(@Nonnull DocBoolean value, DistinctMap map) {
            return map.simpleValues.add(value.getValue() ? SimpleValue.TRUE : SimpleValue.FALSE);
        }

        @Override
        public Boolean visitNumber(@Nonnull DocNumber value, DistinctMap map) {
            return map.numbers.add(value.exactKey());
        }

        @Override
        public Boolean visitString(@Nonnull DocString value, DistinctMap map) {
            return map.addString(value);
        }

        @Override
        public Boolean visitArray(@Nonnull DocArray value, DistinctMap map) {
            if (value.isEmpty()) {
                return map.simpleValues.add(SimpleValue.EMPTY_ARRAY);
            }
            return map.arrays.add(DistinctHash.hash(value));
        }

        @Override
        public Boolean visitObject(@Nonnull DocObject value, DistinctMap map) {
            if (value.isEmpty()) {
                return map.simpleValues.add(SimpleValue.EMPTY_OBJECT);
            }
            return map.objects.add(DistinctHash.hash(value));
        }

        @Override
        public Boolean visitBinary(@Nonnull DocBinary value, DistinctMap map) {
            return map.stringsLength16Plus.add(DistinctHash.hash(value));
        }

        @Override
        public Boolean visitGuid(@Nonnull DocGuid value, DistinctMap map) {
            return map.stringsLength16Plus.add(DistinctHash.hash(value));
        }
    }
}
