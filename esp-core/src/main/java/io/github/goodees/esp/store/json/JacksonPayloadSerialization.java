package io.github.goodees.esp.store.json;

/*-
 * #%L
 * esp
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.esp.core.store.PayloadSerialization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores event body and headers as JSON objects. Dates and {@code Optional}s in payloads are written the way
 * {@link #createMapper()} configures them, and are read back as plain strings and values.
 */
public class JacksonPayloadSerialization implements PayloadSerialization {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {
            };

    private final ObjectMapper mapper;

    public JacksonPayloadSerialization() {
        this(createMapper());
    }

    public JacksonPayloadSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public String serialize(Map<String, Object> payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize payload", e);
        }
    }

    @Override
    public Map<String, Object> deserialize(String payload) {
        if (payload == null || payload.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(payload, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize payload", e);
        }
    }
}
