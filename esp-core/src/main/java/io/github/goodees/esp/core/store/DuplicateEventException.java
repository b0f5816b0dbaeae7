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

import java.util.UUID;

/**
 * Append was rejected because an event with same uuid is already stored. Idempotent writers may treat this as
 * success of a previous attempt.
 */
public class DuplicateEventException extends EventStoreException {
    private final UUID uuid;

    public DuplicateEventException(String aggregateId, UUID uuid, Throwable cause) {
        super(Fault.DUPLICATE_EVENT, "Event " + (uuid == null ? "" : uuid + " ") + "appended to aggregate "
                + aggregateId + " already exists", cause);
        this.uuid = uuid;
    }

    /**
     * The duplicate uuid.
     * @return the uuid, or null when the store only reported violation of unique constraint
     */
    public UUID getUuid() {
        return uuid;
    }
}
