package io.github.goodees.esp.core;

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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A record in the event log.
 *
 * <p>Events are created by callers without {@linkplain #id() id}, {@linkplain #version() version} and
 * {@linkplain #createdAt() commit time}. These are assigned by the event store when the event is committed, and the
 * store returns new instances carrying them. Once assigned, the id of an event never changes.
 *
 * <p>Body and headers are opaque structured data. They need to be serializable by the
 * {@linkplain io.github.goodees.esp.core.store.PayloadSerialization payload serialization} of the store, which in
 * practice means JSON-like maps, lists, strings, numbers and booleans.
 */
public final class Event {
    private final long id;
    private final UUID uuid;
    private final String aggregateId;
    private final long version;
    private final String type;
    private final Map<String, Object> body;
    private final Map<String, Object> headers;
    private final Instant createdAt;

    private Event(Builder b) {
        this.id = b.id;
        this.uuid = b.uuid != null ? b.uuid : UUID.randomUUID();
        this.aggregateId = b.aggregateId;
        this.version = b.version;
        this.type = Objects.requireNonNull(b.type, "Event type must be specified");
        this.body = Collections.unmodifiableMap(new LinkedHashMap<>(b.body));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.createdAt = b.createdAt;
    }

    /**
     * Position of the event in the global log. Strictly increasing in commit order.
     * @return the sequence id, or {@code 0} for event that was not committed yet
     */
    public long id() {
        return id;
    }

    /**
     * Unique identifier of the event, supplied by the caller or generated. Store rejects second event with same uuid.
     * @return the uuid
     */
    public UUID uuid() {
        return uuid;
    }

    /**
     * The id of the aggregate (stream) this event belongs to.
     * @return aggregate id, may be null for event that was not yet appended
     */
    public String aggregateId() {
        return aggregateId;
    }

    /**
     * Version of the aggregate after this event. First event of a stream has version 1.
     * @return the version within the aggregate stream, or {@code 0} if not committed
     */
    public long version() {
        return version;
    }

    public String type() {
        return type;
    }

    public Map<String, Object> body() {
        return body;
    }

    public Map<String, Object> headers() {
        return headers;
    }

    /**
     * Time of commit.
     * @return commit timestamp, null for event that was not committed yet
     */
    public Instant createdAt() {
        return createdAt;
    }

    public boolean isCommitted() {
        return id > 0;
    }

    /**
     * Create a copy of this event with information assigned during commit.
     * @param id assigned sequence id
     * @param aggregateId the aggregate the event was appended to
     * @param version version of aggregate after this event
     * @param createdAt commit timestamp
     * @return committed copy of the event
     */
    public Event committed(long id, String aggregateId, long version, Instant createdAt) {
        return toBuilder().id(id).aggregateId(aggregateId).version(version).createdAt(createdAt).build();
    }

    public Builder toBuilder() {
        return new Builder().id(id).uuid(uuid).aggregateId(aggregateId).version(version).type(type).body(body)
                .headers(headers).createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder ofType(String type) {
        return new Builder().type(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        Event that = (Event) o;

        if (id != that.id)
            return false;
        if (version != that.version)
            return false;
        if (!uuid.equals(that.uuid))
            return false;
        if (!Objects.equals(aggregateId, that.aggregateId))
            return false;
        if (!type.equals(that.type))
            return false;
        return body.equals(that.body) && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        int result = uuid.hashCode();
        result = 31 * result + Long.hashCode(id);
        return result;
    }

    @Override
    public String toString() {
        return "Event{id=" + id + ", uuid=" + uuid + ", aggregateId=" + aggregateId + ", version=" + version
                + ", type=" + type + "}";
    }

    public static class Builder {
        private long id;
        private UUID uuid;
        private String aggregateId;
        private long version;
        private String type;
        private final Map<String, Object> body = new LinkedHashMap<>();
        private final Map<String, Object> headers = new LinkedHashMap<>();
        private Instant createdAt;

        Builder() {
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder uuid(UUID uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder body(Map<String, ?> body) {
            this.body.clear();
            this.body.putAll(body);
            return this;
        }

        public Builder putBody(String key, Object value) {
            this.body.put(key, value);
            return this;
        }

        public Builder headers(Map<String, ?> headers) {
            this.headers.clear();
            this.headers.putAll(headers);
            return this;
        }

        public Builder putHeader(String key, Object value) {
            this.headers.put(key, value);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}
