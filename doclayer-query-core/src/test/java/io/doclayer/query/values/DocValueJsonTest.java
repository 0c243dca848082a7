/*
 * DocValueJsonTest.java
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

import io.doclayer.query.QueryCoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocValueJson} and the equality of {@link DocValue}s.
 */
class DocValueJsonTest {

    @Test
    void parsesEveryJsonType() {
        DocValue value = DocValueJson.parse("{\"s\":\"text\",\"i\":42,\"d\":2.5,\"t\":true,\"f\":false,\"n\":null,\"a\":[1,[]],\"o\":{}}");
        assertEquals(DocValueType.OBJECT, value.getType());
        DocObject object = (DocObject)value;
        assertEquals(DocString.of("text"), object.get("s"));
        assertEquals(DocNumber.of(42L), object.get("i"));
        assertEquals(DocNumber.of(2.5), object.get("d"));
        assertSame(DocBoolean.TRUE, object.get("t"));
        assertSame(DocBoolean.FALSE, object.get("f"));
        assertSame(DocNull.INSTANCE, object.get("n"));
        assertEquals(DocArray.of(DocNumber.of(1L), DocArray.EMPTY), object.get("a"));
        assertSame(DocObject.EMPTY, object.get("o"));
        assertNull(object.get("missing"));
    }

    @Test
    void numberRepresentations() {
        assertTrue(((DocNumber)DocValueJson.parse("7")).isIntegral());
        assertFalse(((DocNumber)DocValueJson.parse("7.0")).isIntegral());
        assertFalse(((DocNumber)DocValueJson.parse("7e2")).isIntegral());
        assertEquals(700.0, ((DocNumber)DocValueJson.parse("7e2")).doubleValue());
        assertEquals(Long.MIN_VALUE, ((DocNumber)DocValueJson.parse("-9223372036854775808")).longValue());
        DocNumber tooBig = (DocNumber)DocValueJson.parse("9223372036854775808");
        assertFalse(tooBig.isIntegral());
        assertEquals(0x1p63, tooBig.doubleValue());
    }

    @Test
    void printsCompactJson() {
        String json = "{\"b\":[true,null,\"x<y\"],\"a\":1,\"c\":{\"d\":-2.5}}";
        assertEquals(json, DocValueJson.parse(json).toString());
    }

    @Test
    void printsBinaryAndGuid() {
        assertEquals("\"AQID\"", DocBinary.of(new byte[] {1, 2, 3}).toString());
        UUID uuid = UUID.fromString("3f1c2a56-8d7e-4b21-9a0f-6c5d4e3b2a19");
        assertEquals("\"3f1c2a56-8d7e-4b21-9a0f-6c5d4e3b2a19\"", DocGuid.of(uuid).toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "{", "nul", "1 2", "{\"a\":}", "[1 2]", "{\"a\" 1}"})
    void rejectsMalformedJson(String json) {
        DocValueParseException e = assertThrows(DocValueParseException.class, () -> DocValueJson.parse(json));
        assertTrue(e instanceof QueryCoreException);
    }

    @Test
    void objectEqualityIgnoresOrder() {
        DocValue first = DocValueJson.parse("{\"a\":1,\"b\":2}");
        DocValue second = DocValueJson.parse("{\"b\":2,\"a\":1}");
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(DocValueJson.parse("[1,2]"), DocValueJson.parse("[2,1]"));
    }

    @Test
    void duplicateKeysAreRejected() {
        DocObject.Builder builder = DocObject.newBuilder().put("a", 1L).put("a", 2L);
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void numberEquality() {
        assertEquals(DocNumber.of(5L), DocNumber.of(5.0));
        assertEquals(DocNumber.of(5L).hashCode(), DocNumber.of(5.0).hashCode());
        assertEquals(DocNumber.of(-0.0), DocNumber.of(0L));
        assertEquals(DocNumber.of(Double.NaN), DocNumber.of(Double.NaN));
        assertNotEquals(DocNumber.of(1L << 53), DocNumber.of((1L << 53) + 1));
        assertNotEquals(DocNumber.of(Long.MAX_VALUE), DocNumber.of((double)Long.MAX_VALUE));
        assertEquals(Long.MAX_VALUE, DocNumber.of(Long.MAX_VALUE).exactKey());
        assertEquals(5.0, DocNumber.of(5L).exactKey());
    }

    @Test
    void binaryIsCopied() {
        byte[] bytes = {1, 2, 3};
        DocBinary binary = DocBinary.of(bytes);
        bytes[0] = 9;
        assertEquals(1, binary.getBytes()[0]);
        assertEquals(DocBinary.of(new byte[] {1, 2, 3}), binary);
    }

    @Test
    void guidBytesAreBigEndian() {
        byte[] bytes = DocGuid.of(new UUID(0x0102030405060708L, 0x090a0b0c0d0e0f10L)).toByteArray();
        for (int i = 0; i < bytes.length; i++) {
            assertEquals(i + 1, bytes[i]);
        }
    }
}
