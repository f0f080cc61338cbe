package io.github.goodees.eventsourced.store;

/*-
 * #%L
 * eventsourced-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON serialization of entity state.
 * @param <T> type of state
 */
public class JacksonSerialization<T> implements Serialization<T> {
    public static final int PAYLOAD_VERSION = 1;

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JacksonSerialization(Class<T> type) {
        this(createMapper(), type);
    }

    public JacksonSerialization(ObjectMapper mapper, Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
    }

    /**
     * Object mapper supporting {@code Optional} and {@code java.time} types, writing dates in ISO format.
     * @return new object mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public int payloadVersion(T object) {
        return PAYLOAD_VERSION;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + type.getName(), e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload, String typeDiscriminator) {
        if (payloadVersion != PAYLOAD_VERSION) {
            throw new IllegalArgumentException("Unsupported payload version " + payloadVersion + " of "
                    + type.getName());
        }
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot deserialize " + type.getName(), e);
        }
    }

    @Override
    public T toSerializable(Object o) {
        return type.isInstance(o) ? type.cast(o) : null;
    }
}
