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

import io.github.goodees.esp.core.tracking.CheckpointRegressionException;
import io.github.goodees.esp.core.tracking.CheckpointTracker;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryCheckpointTracker implements CheckpointTracker {
    private final ConcurrentMap<String, Long> checkpoints = new ConcurrentHashMap<>();
    private final boolean autoCreate;

    public InMemoryCheckpointTracker() {
        this(true);
    }

    public InMemoryCheckpointTracker(boolean autoCreate) {
        this.autoCreate = autoCreate;
    }

    @Override
    public long lastProcessedId(String processorName) {
        if (autoCreate) {
            return checkpoints.computeIfAbsent(processorName, n -> 0L);
        }
        return checkpoints.getOrDefault(processorName, 0L);
    }

    @Override
    public void advance(String processorName, long eventId) {
        checkpoints.compute(processorName, (name, stored) -> {
            if (stored == null && !autoCreate) {
                throw new IllegalStateException("Processor " + processorName
                        + " has no checkpoint and automatic creation is disabled");
            }
            if (stored != null && stored > eventId) {
                throw new CheckpointRegressionException(processorName, stored, eventId);
            }
            return eventId;
        });
    }

    @Override
    public void reset(String processorName) {
        checkpoints.put(processorName, 0L);
    }

    @Override
    public Set<String> trackedProcessors() {
        return Collections.unmodifiableSet(new TreeSet<>(checkpoints.keySet()));
    }
}
