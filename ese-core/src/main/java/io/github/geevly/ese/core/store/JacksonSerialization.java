package io.github.geevly.ese.core.store;

/*-
 * #%L
 * ese
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON serialization of a single type. Payloads are written as UTF-8 JSON, unknown properties are ignored when
 * reading so that fields may be added to events.
 *
 * @param <T> type of serialized objects
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private static final ObjectMapper DEFAULT_MAPPER = createMapper();

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JacksonSerialization(ObjectMapper mapper, Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "Mapper must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
    }

    /**
     * Serialization with shared default mapper.
     * @param type the type to serialize
     * @param <T> the type to serialize
     * @return serialization for the type
     * @see #createMapper()
     */
    public static <T> JacksonSerialization<T> forType(Class<T> type) {
        return new JacksonSerialization<>(DEFAULT_MAPPER, type);
    }

    /**
     * Mapper with support for {@code Optional} and {@code java.time}. Dates are written in ISO format.
     * @return new mapper instance
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
        return mapper;
    }

    @Override
    public byte[] serialize(T object) throws IOException {
        return mapper.writeValueAsBytes(object);
    }

    @Override
    public T deserialize(byte[] payload) throws IOException {
        return mapper.readValue(payload, type);
    }

    public Class<T> getType() {
        return type;
    }
}
