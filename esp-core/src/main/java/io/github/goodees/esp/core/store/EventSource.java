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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Read-only view of an {@link EventStore}. Event processors get this, so they cannot append to the log.
 */
public final class EventSource {
    private final EventStore eventStore;

    public EventSource(EventStore eventStore) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
    }

    /**
     * @see EventStore#readAfter(long, Collection, int)
     */
    public List<Event> readAfter(long cursorId, Collection<String> eventTypes, int limit) {
        return eventStore.readAfter(cursorId, eventTypes, limit);
    }

    public List<Event> readAfter(long cursorId, String eventType, int limit) {
        return eventStore.readAfter(cursorId, eventType == null ? Collections.emptySet()
                : Collections.singleton(eventType), limit);
    }

    public List<Event> readAfter(long cursorId, int limit) {
        return eventStore.readAfter(cursorId, limit);
    }

    public List<Event> readForAggregate(String aggregateId) {
        return eventStore.readForAggregate(aggregateId);
    }

    public long latestId() {
        return eventStore.latestId();
    }

    public long latestId(Collection<String> eventTypes) {
        return eventStore.latestId(eventTypes);
    }

    public void forEachInRange(long fromId, long toId, Collection<String> eventTypes,
            Consumer<List<Event>> batchConsumer) {
        eventStore.forEachInRange(fromId, toId, eventTypes, batchConsumer);
    }
}
