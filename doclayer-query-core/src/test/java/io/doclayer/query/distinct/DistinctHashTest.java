/*
 * DistinctHashTest.java
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
import io.doclayer.query.values.DocValueJson;
import io.doclayer.test.RandomSeedSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * Tests for {@link DistinctHash}.
 */
class DistinctHashTest {

    @Test
    void deterministic() {
        DocValue value = DocValueJson.parse("{\"name\":\"widget\",\"tags\":[\"a\",\"b\"],\"price\":4.5,\"stock\":null}");
        assertEquals(DistinctHash.hash(value), DistinctHash.hash(value));
        assertEquals(DistinctHash.hash(value), DistinctHash.hash(DocValueJson.parse(value.toString())));
    }

    @Test
    void objectsIgnorePropertyOrder() {
        DocValue ab = DocValueJson.parse("{\"a\":1,\"b\":{\"x\":true,\"y\":\"z\"}}");
        DocValue ba = DocValueJson.parse("{\"b\":{\"y\":\"z\",\"x\":true},\"a\":1}");
        assertEquals(DistinctHash.hash(ab), DistinctHash.hash(ba));
    }

    @Test
    void arraysRespectElementOrder() {
        DocValue first = DocArray.of(DocBoolean.TRUE, DocBoolean.FALSE, DocBoolean.TRUE);
        DocValue second = DocArray.of(DocBoolean.TRUE, DocBoolean.TRUE, DocBoolean.FALSE);
        assertNotEquals(DistinctHash.hash(first), DistinctHash.hash(second));
        assertNotEquals(DistinctHash.hash(DocValueJson.parse("[1,2]")), DistinctHash.hash(DocValueJson.parse("[2,1]")));
    }

    @Test
    void sentinelsAreDistinct() {
        List<DocValue> sentinels = Arrays.asList(null, DocNull.INSTANCE, DocBoolean.TRUE, DocBoolean.FALSE,
                DocString.EMPTY, DocArray.EMPTY, DocObject.EMPTY, DocBinary.of(new byte[0]), DocNumber.of(0L));
        Set<UInt128> hashes = new HashSet<>();
        for (DocValue sentinel : sentinels) {
            hashes.add(DistinctHash.hash(sentinel));
        }
        assertEquals(sentinels.size(), hashes.size());
    }

    @Test
    void unpairedSurrogatesHashOnTheirOwn() {
        Set<UInt128> hashes = new HashSet<>();
        for (String text : Arrays.asList("?", "\uFFFD", "\uD800", "\uDC00", "\uDC00\uD800")) {
            hashes.add(DistinctHash.hash(DocString.of(text)));
        }
        assertEquals(5, hashes.size());
        assertNotEquals(DistinctHash.hash(DocValueJson.parse("{\"?\":1}")),
                DistinctHash.hash(DocObject.newBuilder().put("\uD800", 1L).build()));
        assertEquals(DistinctHash.hash(DocString.of("\uD800")), DistinctHash.hash(DocString.of("\uD800")));
    }

    @Test
    void undefinedLeavesSeedUnchanged() {
        UInt128 seed = UInt128.create(17L, 42L);
        assertEquals(seed, DistinctHash.hash(null, seed));
        assertEquals(DistinctHash.ROOT_SEED, DistinctHash.hash(null));
        assertNotEquals(DistinctHash.hash(DocNull.INSTANCE, seed), seed);
    }

    static Stream<Arguments> equalValues() {
        return Stream.of(
                Arguments.of("integer and double", DocNumber.of(5L), DocNumber.of(5.0)),
                Arguments.of("negative zero", DocNumber.of(-0.0), DocNumber.of(0.0)),
                Arguments.of("integer zero and negative zero", DocNumber.of(0L), DocNumber.of(-0.0)),
                Arguments.of("nan", DocNumber.of(Double.NaN), DocNumber.of(0.0 / 0.0)),
                Arguments.of("numbers in arrays", DocValueJson.parse("[1,2.0]"), DocValueJson.parse("[1.0,2]")),
                Arguments.of("nested objects", DocValueJson.parse("{\"o\":{\"p\":1,\"q\":2}}"),
                        DocValueJson.parse("{\"o\":{\"q\":2,\"p\":1}}")),
                Arguments.of("guids", DocGuid.of(UUID.fromString("3f1c2a56-8d7e-4b21-9a0f-6c5d4e3b2a19")),
                        DocGuid.of(UUID.fromString("3F1C2A56-8D7E-4B21-9A0F-6C5D4E3B2A19")))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("equalValues")
    void equalValuesHashEqual(String description, DocValue value1, DocValue value2) {
        assertEquals(value1, value2);
        assertEquals(DistinctHash.hash(value1), DistinctHash.hash(value2));
    }

    static Stream<Arguments> unequalValues() {
        return Stream.of(
                Arguments.of("string and number", DocString.of("1"), DocNumber.of(1L)),
                Arguments.of("string and binary", DocString.of("abc"),
                        DocBinary.of("abc".getBytes(StandardCharsets.UTF_8))),
                Arguments.of("array and object", DocValueJson.parse("[1]"), DocValueJson.parse("{\"0\":1}")),
                Arguments.of("different property values", DocValueJson.parse("{\"a\":1}"), DocValueJson.parse("{\"a\":2}")),
                Arguments.of("different property names", DocValueJson.parse("{\"a\":1}"), DocValueJson.parse("{\"b\":1}")),
                Arguments.of("null property and empty object", DocValueJson.parse("{\"a\":null}"), DocObject.EMPTY),
                Arguments.of("nested and flat arrays", DocValueJson.parse("[[1,2]]"), DocValueJson.parse("[1,2]")),
                Arguments.of("empty array in array", DocValueJson.parse("[[]]"), DocValueJson.parse("[]")),
                Arguments.of("adjacent doubles", DocNumber.of(1.0), DocNumber.of(Math.nextUp(1.0))),
                Arguments.of("guid and its bytes", DocGuid.of(new UUID(1L, 2L)),
                        DocBinary.of(DocGuid.of(new UUID(1L, 2L)).toByteArray()))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("unequalValues")
    void unequalValuesHashDifferently(String description, DocValue value1, DocValue value2) {
        assertNotEquals(value1, value2);
        assertNotEquals(DistinctHash.hash(value1), DistinctHash.hash(value2));
    }

    @ParameterizedTest
    @RandomSeedSource({0x0fdbL, 0x5ca1eL})
    void shuffledPropertiesHashEqual(long seed) {
        RandomDocuments documents = new RandomDocuments(seed);
        for (int i = 0; i < 500; i++) {
            DocValue value = documents.next();
            DocValue shuffled = documents.shuffleProperties(value);
            assertEquals(value, shuffled);
            assertEquals(DistinctHash.hash(value), DistinctHash.hash(shuffled), () -> "hash differs for " + value);
        }
    }

    @ParameterizedTest
    @RandomSeedSource({0x0fdbL, 0x5ca1eL})
    void equalityAgreesWithHash(long seed) {
        RandomDocuments documents = new RandomDocuments(seed);
        Set<DocValue> values = new HashSet<>();
        Set<UInt128> hashes = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            DocValue value = documents.next();
            assertEquals(values.add(value), hashes.add(DistinctHash.hash(value)), () -> "disagreement on " + value);
        }
    }
}
