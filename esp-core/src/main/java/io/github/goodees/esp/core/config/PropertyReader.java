package io.github.goodees.esp.core.config;

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

import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;

class PropertyReader {
    private final Properties properties;

    PropertyReader(Properties properties) {
        this.properties = properties;
    }

    <T> void read(String key, Function<String, T> parser, Consumer<T> target) {
        String value = properties.getProperty(key);
        if (value == null) {
            return;
        }
        T parsed;
        try {
            parsed = parser.apply(value.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value of " + key + ": '" + value + "'", e);
        }
        target.accept(parsed);
    }

    static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Expected true or false");
    }
}
