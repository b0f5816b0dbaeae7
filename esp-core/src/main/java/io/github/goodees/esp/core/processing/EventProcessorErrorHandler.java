package io.github.goodees.esp.core.processing;

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

/**
 * Callback for reporting failures of event processors, e. g. to an error tracking service.
 */
@FunctionalInterface
public interface EventProcessorErrorHandler {

    void onError(Throwable error, String processorName);

    static EventProcessorErrorHandler ignore() {
        return (error, processorName) -> {
        };
    }
}
