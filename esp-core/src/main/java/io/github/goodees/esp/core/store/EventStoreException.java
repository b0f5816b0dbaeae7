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

import java.util.UUID;

/**
 * Exception signalling failure to append events. The {@link #getFault() fault} determines whether the caller should
 * reload the aggregate and retry, or whether the failure is a bug.
 *
 * @see ConcurrencyException
 * @see DuplicateEventException
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, DUPLICATE_EVENT, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static ConcurrencyException optimisticLock(String aggregateId, long currentVersion, long expectedVersion) {
        return new ConcurrencyException(aggregateId, currentVersion, expectedVersion);
    }

    public static DuplicateEventException duplicate(String aggregateId, UUID uuid) {
        return new DuplicateEventException(aggregateId, uuid, null);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Append to aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException multipleAggregates(String expected, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Appended events span multiple aggregates: " + expected
                + " and " + violating.aggregateId(), null);
    }

    public static EventStoreException alreadyCommitted(String aggregateId, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event " + violating + " appended to " + aggregateId
                + " has already been committed", null);
    }

    public static EventStoreException unsupported(Event event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Cannot serialize event: " + event, cause);
    }
}
