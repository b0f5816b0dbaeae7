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
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Append-only, globally ordered log of events.
 *
 * <p>Every committed event receives a sequence {@linkplain Event#id() id}. Ids grow in commit order, so a reader that
 * remembers the highest id it has seen can ask for everything after it and will not miss events committed
 * concurrently with its reads. Appends are checked with optimistic locking against the version of the aggregate
 * stream.
 *
 * <p>Callers that only need to read or only need to write should get an {@link EventSource} or {@link EventSink}
 * instead.
 */
public interface EventStore {
    /**
     * Expected version that disables the optimistic lock check.
     */
    long ANY_VERSION = -1;

    /**
     * Returned by {@link #latestId()} when there are no events.
     */
    long NO_EVENTS = 0;

    int DEFAULT_RANGE_BATCH_SIZE = 1000;

    /**
     * Atomically append events to the stream of an aggregate.
     *
     * @param aggregateId the aggregate the events belong to
     * @param expectedVersion version of the aggregate the caller based its decision on, {@code 0} for new aggregate,
     *                        or {@link #ANY_VERSION}
     * @param events uncommitted events. Their aggregate id must be unset or equal to {@code aggregateId}
     * @return the committed events, with assigned ids, versions and timestamps
     * @throws ConcurrencyException when the aggregate is not at {@code expectedVersion}
     * @throws DuplicateEventException when an event with same uuid already exists
     * @throws EventStoreException when the storage fails, or the events are invalid
     */
    List<Event> append(String aggregateId, long expectedVersion, List<Event> events) throws EventStoreException;

    /**
     * Read events committed after a position.
     * @param cursorId events with id greater than this are returned
     * @param eventTypes types to include, empty collection for all types
     * @param limit maximum number of events
     * @return events in ascending order of id, empty list if there are none
     */
    List<Event> readAfter(long cursorId, Collection<String> eventTypes, int limit);

    /**
     * Read entire stream of an aggregate.
     * @param aggregateId the id of aggregate
     * @return events of the aggregate in order of their ids
     */
    List<Event> readForAggregate(String aggregateId);

    /**
     * Highest id among events of given types.
     * @param eventTypes types to consider, empty collection for all
     * @return highest id, or {@link #NO_EVENTS}
     */
    long latestId(Collection<String> eventTypes);

    /**
     * Current version of an aggregate stream.
     * @param aggregateId id of aggregate
     * @return number of events appended to the aggregate, {@code 0} for unknown aggregate
     */
    long aggregateVersion(String aggregateId);

    default List<Event> readAfter(long cursorId, int limit) {
        return readAfter(cursorId, Collections.emptySet(), limit);
    }

    default long latestId() {
        return latestId(Collections.emptySet());
    }

    /**
     * Iterate over events with ids in range {@code [fromId, toId]}, in batches.
     * @param fromId first id of the range (inclusive)
     * @param toId last id of the range (inclusive)
     * @param eventTypes types to include, empty for all
     * @param batchConsumer receives non-empty batches in ascending order
     */
    default void forEachInRange(long fromId, long toId, Collection<String> eventTypes,
            Consumer<List<Event>> batchConsumer) {
        long cursor = fromId - 1;
        while (cursor < toId) {
            List<Event> batch = readAfter(cursor, eventTypes, DEFAULT_RANGE_BATCH_SIZE);
            if (batch.isEmpty()) {
                return;
            }
            Event last = batch.get(batch.size() - 1);
            if (last.id() > toId) {
                batch = batch.stream().filter(e -> e.id() <= toId).collect(toList());
                if (!batch.isEmpty()) {
                    batchConsumer.accept(batch);
                }
                return;
            }
            batchConsumer.accept(batch);
            cursor = last.id();
        }
    }
}
