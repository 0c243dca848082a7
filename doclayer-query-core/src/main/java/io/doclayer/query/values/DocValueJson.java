/*
 * DocValueJson.java
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
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.doclayer.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Conversion between JSON text and {@link DocValue}s.
 *
 * <p>
 * Parsing is strict: the text must hold exactly one JSON document. Integer literals that fit in a {@code long}
 * become integral {@link DocNumber}s; every other number becomes a floating point one. JSON has no binary or guid
 * type, so {@link DocBinary} prints as a base64 string and {@link DocGuid} as its canonical string form, and
 * neither comes back from {@link #parse(String)}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class DocValueJson {
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .create();
    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = GSON.getAdapter(JsonElement.class);

    private DocValueJson() {
    }

    /**
     * Parse JSON text into a value.
     * @param json the text to parse
     * @return the parsed value
     * @throws DocValueParseException if the text is not exactly one well-formed JSON document
     */
    @Nonnull
    public static DocValue parse(@Nonnull String json) {
        final JsonElement element;
        try (JsonReader reader = new JsonReader(new StringReader(json))) {
            reader.setLenient(false);
            element = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new DocValueParseException("trailing data after JSON document")
                        .addLogInfo(LogMessageKeys.RAW_JSON, json);
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new DocValueParseException("unable to parse JSON document", e)
                    .addLogInfo(LogMessageKeys.RAW_JSON, json);
        }
        if (element == null) {
            throw new DocValueParseException("empty JSON document");
        }
        return fromJsonElement(element);
    }

    @Nonnull
    static DocValue fromJsonElement(@Nonnull JsonElement element) {
        if (element.isJsonNull()) {
            return DocNull.INSTANCE;
        } else if (element.isJsonArray()) {
            List<DocValue> elements = new ArrayList<>();
            for (JsonElement child : element.getAsJsonArray()) {
                elements.add(fromJsonElement(child));
            }
            return DocArray.of(elements);
        } else if (element.isJsonObject()) {
            DocObject.Builder builder = DocObject.newBuilder();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                builder.put(entry.getKey(), fromJsonElement(entry.getValue()));
            }
            return builder.build();
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return DocBoolean.of(primitive.getAsBoolean());
        } else if (primitive.isNumber()) {
            return parseNumber(primitive.getAsString());
        } else {
            return DocString.of(primitive.getAsString());
        }
    }

    @Nonnull
    private static DocNumber parseNumber(@Nonnull String text) {
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            BigInteger integer = new BigInteger(text);
            if (integer.bitLength() < Long.SIZE) {
                return DocNumber.of(integer.longValue());
            }
        }
        return DocNumber.of(Double.parseDouble(text));
    }

    /**
     * Print a value as compact JSON text.
     * @param value the value to print
     * @return the JSON text
     */
    @Nonnull
    public static String toJson(@Nonnull DocValue value) {
        return GSON.toJson(toJsonElement(value));
    }

    @Nonnull
    static JsonElement toJsonElement(@Nonnull DocValue value) {
        return value.accept(ToJsonVisitor.INSTANCE, null);
    }

    private static class ToJsonVisitor implements DocValueVisitor<JsonElement, Void> {
        private static final ToJsonVisitor INSTANCE = new ToJsonVisitor();

        @Override
        public JsonElement visitNull(@Nonnull DocNull value, Void arg) {
            return JsonNull.INSTANCE;
        }

        @Override
        public JsonElement visitBoolean(@Nonnull DocBoolean value, Void arg) {
            return new JsonPrimitive(value.getValue());
        }

        @Override
        public JsonElement visitNumber(@Nonnull DocNumber value, Void arg) {
            if (value.isIntegral()) {
                return new JsonPrimitive(value.longValue());
            }
            return new JsonPrimitive(value.doubleValue());
        }

        @Override
        public JsonElement visitString(@Nonnull DocString value, Void arg) {
            return new JsonPrimitive(value.getValue());
        }

        @Override
        public JsonElement visitArray(@Nonnull DocArray value, Void arg) {
            JsonArray array = new JsonArray(value.size());
            for (DocValue element : value) {
                array.add(element.accept(this, arg));
            }
            return array;
        }

        @Override
        public JsonElement visitObject(@Nonnull DocObject value, Void arg) {
            JsonObject object = new JsonObject();
            for (Map.Entry<String, DocValue> entry : value.getProperties().entrySet()) {
                object.add(entry.getKey(), entry.getValue().accept(this, arg));
            }
            return object;
        }

        @Override
        public JsonElement visitBinary(@Nonnull DocBinary value, Void arg) {
            return new JsonPrimitive(Base64.getEncoder().encodeToString(value.getBytes()));
        }

        @Override
        public JsonElement visitGuid(@Nonnull DocGuid value, Void arg) {
            return new JsonPrimitive(value.getValue().toString());
        }
    }
}
