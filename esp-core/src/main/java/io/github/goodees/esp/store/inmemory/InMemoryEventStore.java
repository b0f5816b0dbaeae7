package io.github.goodees.esp.store.inmemory;

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
import io.github.goodees.esp.core.store.EventStore;
import io.github.goodees.esp.core.store.EventStoreException;
import io.github.goodees.esp.core.store.NewEventNotifier;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Event store keeping the log in memory, for tests and single-process tools. All operations synchronize on the
 * store, which makes appends trivially linear.
 */
public class InMemoryEventStore implements EventStore {
    private final List<Event> log = new ArrayList<>();
    private final Map<String, List<Event>> aggregates = new HashMap<>();
    private final Set<UUID> uuids = new HashSet<>();
    private final NewEventNotifier notifier;

    public InMemoryEventStore() {
        this(new NewEventNotifier());
    }

    public InMemoryEventStore(NewEventNotifier notifier) {
        this.notifier = notifier;
    }

    @Override
    public List<Event> append(String aggregateId, long expectedVersion, List<Event> events)
            throws EventStoreException {
        List<Event> committed = doAppend(aggregateId, expectedVersion, events);
        if (!committed.isEmpty()) {
            notifier.eventsAppended(committed.get(committed.size() - 1).id());
        }
        return committed;
    }

    private synchronized List<Event> doAppend(String aggregateId, long expectedVersion, List<Event> events)
            throws EventStoreException {
        if (aggregateId == null) {
            throw new IllegalArgumentException("Aggregate id must be specified");
        }
        Set<UUID> batchUuids = new HashSet<>();
        for (Event event : events) {
            if (event.isCommitted()) {
                throw EventStoreException.alreadyCommitted(aggregateId, event);
            }
            if (event.aggregateId() != null && !aggregateId.equals(event.aggregateId())) {
                throw EventStoreException.multipleAggregates(aggregateId, event);
            }
            if (!batchUuids.add(event.uuid()) || uuids.contains(event.uuid())) {
                throw EventStoreException.duplicate(aggregateId, event.uuid());
            }
        }
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        long version = aggregateVersion(aggregateId);
        if (expectedVersion != ANY_VERSION && version != expectedVersion) {
            throw EventStoreException.optimisticLock(aggregateId, version, expectedVersion);
        }
        Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        List<Event> stream = aggregates.computeIfAbsent(aggregateId, id -> new ArrayList<>());
        List<Event> committed = new ArrayList<>(events.size());
        for (Event event : events) {
            Event stored = event.committed(log.size() + 1, aggregateId, ++version, createdAt);
            log.add(stored);
            stream.add(stored);
            uuids.add(stored.uuid());
            committed.add(stored);
        }
        return committed;
    }

    @Override
    public synchronized List<Event> readAfter(long cursorId, Collection<String> eventTypes, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, was " + limit);
        }
        List<Event> result = new ArrayList<>();
        if (cursorId >= log.size()) {
            return result;
        }
        // ids are positions in the log starting at 1
        for (int i = (int) Math.max(0, cursorId); i < log.size() && result.size() < limit; i++) {
            Event event = log.get(i);
            if (eventTypes.isEmpty() || eventTypes.contains(event.type())) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public synchronized List<Event> readForAggregate(String aggregateId) {
        return new ArrayList<>(aggregates.getOrDefault(aggregateId, Collections.emptyList()));
    }

    @Override
    public synchronized long latestId(Collection<String> eventTypes) {
        for (int i = log.size() - 1; i >= 0; i--) {
            Event event = log.get(i);
            if (eventTypes.isEmpty() || eventTypes.contains(event.type())) {
                return event.id();
            }
        }
        return NO_EVENTS;
    }

    @Override
    public synchronized long aggregateVersion(String aggregateId) {
        return aggregates.getOrDefault(aggregateId, Collections.emptyList()).size();
    }

    public NewEventNotifier getNotifier() {
        return notifier;
    }
}
