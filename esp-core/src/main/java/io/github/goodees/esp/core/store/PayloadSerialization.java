package io.github.goodees.esp.core.store;

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

import java.util.Map;

/**
 * Conversion of event body and headers into String payload stored in the database.
 */
public interface PayloadSerialization {
    /**
     * Serialize structured data.
     * @param payload body or headers of an event
     * @return String representation of the payload
     * @throws IllegalArgumentException when the payload contains values that cannot be serialized
     */
    String serialize(Map<String, Object> payload);

    /**
     * Read payload stored by {@link #serialize(Map)}.
     * @param payload stored payload, might be null
     * @return deserialized map, empty map for null payload
     * @throws IllegalArgumentException when the payload cannot be read
     */
    Map<String, Object> deserialize(String payload);
}
