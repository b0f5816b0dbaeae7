package io.github.goodees.esp.core.tracking;

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

import java.util.Set;

/**
 * Durable position of event processors in the event log.
 *
 * <p>Each processor has a single checkpoint, the id of the last event it has fully processed. The tracker assumes
 * single writer per processor name: one running subscription advances a checkpoint. Implementations must make the
 * update durable before {@link #advance(String, long)} returns, so that a crash after handling an event causes the
 * event to be redelivered rather than lost.
 */
public interface CheckpointTracker {

    /**
     * Read checkpoint of a processor. Missing checkpoint is created at {@code 0}, if the tracker creates them
     * automatically.
     * @param processorName name of the processor
     * @return id of last processed event, {@code 0} for processor that has not processed anything
     */
    long lastProcessedId(String processorName);

    /**
     * Move checkpoint forward. Advancing to current value is accepted.
     * @param processorName name of the processor
     * @param eventId id of last processed event
     * @throws CheckpointRegressionException when {@code eventId} is lower than the stored checkpoint
     * @throws IllegalStateException when the checkpoint doesn't exist and the tracker doesn't create them
     *                               automatically, or when the storage fails
     */
    void advance(String processorName, long eventId);

    /**
     * Move the checkpoint back to the start of the log, so the processor would process all events again. This is an
     * operator action, processors never call it.
     * @param processorName name of the processor
     */
    void reset(String processorName);

    /**
     * Names of all processors with checkpoint.
     * @return set of processor names
     */
    Set<String> trackedProcessors();
}
