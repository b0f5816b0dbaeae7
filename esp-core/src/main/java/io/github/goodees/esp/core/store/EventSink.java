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

import io.github.goodees.esp.core.Event;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Write-only view of an {@link EventStore}, intended for command handlers.
 */
public final class EventSink {
    private final EventStore eventStore;

    public EventSink(EventStore eventStore) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
    }

    /**
     * @see EventStore#append(String, long, List)
     */
    public List<Event> append(String aggregateId, long expectedVersion, List<Event> events)
            throws EventStoreException {
        return eventStore.append(aggregateId, expectedVersion, events);
    }

    public List<Event> append(String aggregateId, long expectedVersion, Event... events) throws EventStoreException {
        return eventStore.append(aggregateId, expectedVersion, Arrays.asList(events));
    }

    /**
     * Append without optimistic lock check.
     * @param aggregateId the aggregate
     * @param events events to append
     * @return committed events
     * @throws EventStoreException when storing fails
     */
    public List<Event> append(String aggregateId, List<Event> events) throws EventStoreException {
        return eventStore.append(aggregateId, EventStore.ANY_VERSION, events);
    }
}
