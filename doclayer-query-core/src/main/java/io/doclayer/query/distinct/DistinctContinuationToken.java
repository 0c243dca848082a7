/*
 * DistinctContinuationToken.java
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
import io.doclayer.query.MalformedContinuationTokenException;
import io.doclayer.query.logging.LogMessageKeys;
import io.doclayer.query.values.DocNull;
import io.doclayer.query.values.DocObject;
import io.doclayer.query.values.DocString;
import io.doclayer.query.values.DocValue;
import io.doclayer.query.values.DocValueJson;
import io.doclayer.query.values.DocValueParseException;
import io.doclayer.query.values.DocValueType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The continuation of a DISTINCT query: the continuation of the source it reads from, paired with the
 * continuation of its {@link DistinctMap}. Neither half is interpreted here.
 *
 * <p>
 * As a value, the token is an object with exactly the string properties {@code SourceToken} and
 * {@code DistinctMapToken}. {@code SourceToken} is {@code null} when the source has no continuation of its own.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class DistinctContinuationToken {
    static final String SOURCE_TOKEN = "SourceToken";
    static final String DISTINCT_MAP_TOKEN = "DistinctMapToken";

    @Nullable
    private final String sourceToken;
    @Nonnull
    private final String distinctMapToken;

    public DistinctContinuationToken(@Nullable String sourceToken, @Nonnull String distinctMapToken) {
        this.sourceToken = sourceToken;
        this.distinctMapToken = Objects.requireNonNull(distinctMapToken);
    }

    @Nullable
    public String getSourceToken() {
        return sourceToken;
    }

    @Nonnull
    public String getDistinctMapToken() {
        return distinctMapToken;
    }

    @Nonnull
    public DocObject toDocValue() {
        return DocObject.newBuilder()
                .put(SOURCE_TOKEN, sourceToken == null ? DocNull.INSTANCE : DocString.of(sourceToken))
                .put(DISTINCT_MAP_TOKEN, distinctMapToken)
                .build();
    }

    /**
     * Parse a token from its JSON text.
     * @param token the text of a token, as returned by {@link #toString()}
     * @return the parsed token
     * @throws MalformedContinuationTokenException if the text is not JSON or does not have the expected structure
     */
    @Nonnull
    public static DistinctContinuationToken parse(@Nonnull String token) {
        final DocValue value;
        try {
            value = DocValueJson.parse(token);
        } catch (DocValueParseException e) {
            throw new MalformedContinuationTokenException("distinct continuation is not valid JSON", e)
                    .addLogInfo(LogMessageKeys.RAW_TOKEN, token);
        }
        return parse(value);
    }

    /**
     * Read a token from a value.
     * @param value an object with the properties {@code SourceToken} and {@code DistinctMapToken}
     * @return the token
     * @throws MalformedContinuationTokenException if the value does not have the expected structure
     */
    @Nonnull
    public static DistinctContinuationToken parse(@Nonnull DocValue value) {
        if (value.getType() != DocValueType.OBJECT) {
            throw new MalformedContinuationTokenException("distinct continuation is not an object",
                    LogMessageKeys.RAW_TOKEN, value,
                    LogMessageKeys.ACTUAL_TYPE, value.getType());
        }
        DocObject object = (DocObject)value;
        if (object.size() != 2) {
            throw new MalformedContinuationTokenException("distinct continuation has unexpected fields",
                    LogMessageKeys.RAW_TOKEN, value,
                    LogMessageKeys.FIELD_COUNT, object.size());
        }
        DocValue source = object.get(SOURCE_TOKEN);
        if (source == null || (source.getType() != DocValueType.STRING && source.getType() != DocValueType.NULL)) {
            throw wrongField(SOURCE_TOKEN, source, value);
        }
        DocValue distinctMap = object.get(DISTINCT_MAP_TOKEN);
        if (distinctMap == null || distinctMap.getType() != DocValueType.STRING) {
            throw wrongField(DISTINCT_MAP_TOKEN, distinctMap, value);
        }
        String sourceToken = source.getType() == DocValueType.NULL ? null : ((DocString)source).getValue();
        return new DistinctContinuationToken(sourceToken, ((DocString)distinctMap).getValue());
    }

    @Nonnull
    private static MalformedContinuationTokenException wrongField(@Nonnull String fieldName, @Nullable DocValue actual,
                                                                  @Nonnull DocValue token) {
        return new MalformedContinuationTokenException("distinct continuation field is missing or has the wrong type",
                LogMessageKeys.RAW_TOKEN, token,
                LogMessageKeys.FIELD_NAME, fieldName,
                LogMessageKeys.ACTUAL_TYPE, actual == null ? "missing" : actual.getType());
    }

    /**
     * Returns the JSON text of this token.
     * @return this token as JSON
     */
    @Override
    public String toString() {
        return DocValueJson.toJson(toDocValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DistinctContinuationToken that = (DistinctContinuationToken)o;
        return Objects.equals(sourceToken, that.sourceToken) && distinctMapToken.equals(that.distinctMapToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceToken, distinctMapToken);
    }
}
