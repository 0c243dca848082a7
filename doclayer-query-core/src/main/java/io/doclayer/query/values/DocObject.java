/*
 * DocObject.java
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
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * A mapping from unique string keys to values.
 *
 * <p>
 * Properties keep the order they were added in, which is the order they are printed in. That order plays no part
 * in equality: two objects are equal when they have the same set of key and value pairs.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class DocObject extends DocValue {
    public static final DocObject EMPTY = new DocObject(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<String, DocValue> properties;

    private DocObject(@Nonnull ImmutableMap<String, DocValue> properties) {
        this.properties = properties;
    }

    @Nonnull
    public static DocObject of(@Nonnull Map<String, ? extends DocValue> properties) {
        return properties.isEmpty() ? EMPTY : new DocObject(ImmutableMap.copyOf(properties));
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Map<String, DocValue> getProperties() {
        return properties;
    }

    /**
     * Get the value of a property.
     * @param key the property name
     * @return the property value, or {@code null} if this object has no such property
     */
    @Nullable
    public DocValue get(@Nonnull String key) {
        return properties.get(key);
    }

    public boolean containsKey(@Nonnull String key) {
        return properties.containsKey(key);
    }

    public int size() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    @Nonnull
    @Override
    public DocValueType getType() {
        return DocValueType.OBJECT;
    }

    @Override
    public <R, A> R accept(@Nonnull DocValueVisitor<R, A> visitor, A arg) {
        return visitor.visitObject(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocObject && ((DocObject)o).properties.equals(properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    /**
     * Builder for {@link DocObject}. Adding the same key twice fails when the object is built.
     */
    public static class Builder {
        private final ImmutableMap.Builder<String, DocValue> properties = ImmutableMap.builder();

        private Builder() {
        }

        @Nonnull
        public Builder put(@Nonnull String key, @Nonnull DocValue value) {
            properties.put(key, value);
            return this;
        }

        @Nonnull
        public Builder put(@Nonnull String key, @Nonnull String value) {
            return put(key, DocString.of(value));
        }

        @Nonnull
        public Builder put(@Nonnull String key, long value) {
            return put(key, DocNumber.of(value));
        }

        @Nonnull
        public DocObject build() {
            ImmutableMap<String, DocValue> built = properties.build();
            return built.isEmpty() ? EMPTY : new DocObject(built);
        }
    }
}
