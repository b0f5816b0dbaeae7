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

/**
 * Append was rejected because another writer appended to the aggregate since the caller read it. The caller must
 * reload the aggregate and retry the command.
 */
public class ConcurrencyException extends EventStoreException {
    private final String aggregateId;
    private final long currentVersion;
    private final long expectedVersion;

    public ConcurrencyException(String aggregateId, long currentVersion, long expectedVersion) {
        this(aggregateId, currentVersion, expectedVersion, null);
    }

    public ConcurrencyException(String aggregateId, long currentVersion, long expectedVersion, Throwable cause) {
        super(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId + " expected at version " + expectedVersion
                + " while last known version is " + currentVersion, cause);
        this.aggregateId = aggregateId;
        this.currentVersion = currentVersion;
        this.expectedVersion = expectedVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Version the store observed. Might be {@code -1} when the conflict was detected only by a failed version update.
     * @return version of the aggregate in the store
     */
    public long getCurrentVersion() {
        return currentVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
