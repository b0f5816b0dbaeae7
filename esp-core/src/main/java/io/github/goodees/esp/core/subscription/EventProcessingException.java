package io.github.goodees.esp.core.subscription;

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

import io.github.goodees.esp.core.Event;

/**
 * Failure of an event handler, together with the event it was processing.
 */
public class EventProcessingException extends RuntimeException {
    private final Event event;

    public EventProcessingException(Event event, Throwable cause) {
        super("Processing of event " + event.id() + " (" + event.type() + ", " + event.uuid() + ") failed: "
                + cause.getMessage(), cause);
        this.event = event;
    }

    public Event getEvent() {
        return event;
    }
}
