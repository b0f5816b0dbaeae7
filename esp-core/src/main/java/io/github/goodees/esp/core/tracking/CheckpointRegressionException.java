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

/**
 * Attempt to move checkpoint backwards. This always means that events are being processed out of order, or that two
 * subscriptions run under same processor name.
 */
public class CheckpointRegressionException extends IllegalStateException {
    private final String processorName;
    private final long storedId;
    private final long attemptedId;

    public CheckpointRegressionException(String processorName, long storedId, long attemptedId) {
        super("Checkpoint of " + processorName + " is at " + storedId + ", cannot move it back to " + attemptedId);
        this.processorName = processorName;
        this.storedId = storedId;
        this.attemptedId = attemptedId;
    }

    public String getProcessorName() {
        return processorName;
    }

    public long getStoredId() {
        return storedId;
    }

    public long getAttemptedId() {
        return attemptedId;
    }
}
