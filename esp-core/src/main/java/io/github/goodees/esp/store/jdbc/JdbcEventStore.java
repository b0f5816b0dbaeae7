package io.github.goodees.esp.store.jdbc;

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
import io.github.goodees.esp.core.config.EspConfiguration;
import io.github.goodees.esp.core.store.ConcurrencyException;
import io.github.goodees.esp.core.store.DuplicateEventException;
import io.github.goodees.esp.core.store.EventStore;
import io.github.goodees.esp.core.store.EventStoreException;
import io.github.goodees.esp.core.store.NewEventNotifier;
import io.github.goodees.esp.core.store.PayloadSerialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Event store in relational database.
 *
 * <p>Append runs in single transaction:
 * <ol>
 *     <li>the append lock is acquired (unless disabled), so that appends commit in the order of their ids</li>
 *     <li>aggregate version is read and compared with expected version</li>
 *     <li>events are inserted, receiving their ids from identity column</li>
 *     <li>aggregate version is updated with optimistic check</li>
 *     <li>the schema announces the append to other processes, where the database supports it
 *     ({@link PostgresJdbcSchema})</li>
 * </ol>
 * <p>After commit the {@link NewEventNotifier} is told about the new events. The connection is returned to the data
 * source with its auto commit mode restored.
 */
public class JdbcEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final PayloadSerialization serialization;
    private final NewEventNotifier notifier;
    private final boolean lockForAppend;

    public JdbcEventStore(DataSource dataSource, EspConfiguration configuration, PayloadSerialization serialization,
            NewEventNotifier notifier) {
        this(dataSource, new DefaultJdbcSchema(configuration), serialization, notifier,
            configuration.isLockTableToGuaranteeLinearSequenceIdGrowth());
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, PayloadSerialization serialization,
            NewEventNotifier notifier, boolean lockForAppend) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.notifier = notifier;
        this.lockForAppend = lockForAppend;
        if (!lockForAppend) {
            logger.warn("Append lock is disabled, subscriptions may miss events committed out of id order");
        }
    }

    @Override
    public List<Event> append(String aggregateId, long expectedVersion, List<Event> events)
            throws EventStoreException {
        AppendTemplate template = createTemplate(aggregateId, expectedVersion);
        for (Event event : events) {
            template.addEvent(event);
        }
        List<Event> committed = template.append();
        if (!committed.isEmpty()) {
            notifier.eventsAppended(committed.get(committed.size() - 1).id());
        }
        return committed;
    }

    protected AppendTemplate createTemplate(String aggregateId, long expectedVersion) {
        return new AppendTemplate(aggregateId, expectedVersion);
    }

    @Override
    public List<Event> readAfter(long cursorId, Collection<String> eventTypes, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, was " + limit);
        }
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectEventsAfter(connection, cursorId, eventTypes, limit);
                ResultSet rs = st.executeQuery()) {
            return readEvents(rs);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public List<Event> readForAggregate(String aggregateId) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectEventsForAggregate(connection, aggregateId);
                ResultSet rs = st.executeQuery()) {
            return readEvents(rs);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public long latestId(Collection<String> eventTypes) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectLatestId(connection, eventTypes);
                ResultSet rs = st.executeQuery()) {
            // MAX over no rows is NULL, which reads as 0
            return rs.next() ? rs.getLong(1) : NO_EVENTS;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public long aggregateVersion(String aggregateId) {
        try (Connection connection = dataSource.getConnection()) {
            return readAggregateVersion(connection, aggregateId);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    public NewEventNotifier getNotifier() {
        return notifier;
    }

    private long readAggregateVersion(Connection connection, String aggregateId) throws SQLException {
        try (PreparedStatement st = schema.selectAggregateVersion(connection, aggregateId);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readAggregateVersion(rs) : 0;
        }
    }

    private List<Event> readEvents(ResultSet rs) throws SQLException {
        List<Event> result = new ArrayList<>();
        while (rs.next()) {
            try {
                result.add(schema.readEvent(rs, serialization));
            } catch (IllegalArgumentException e) {
                // corrupt payload or uuid in stored row
                throw new IllegalStateException("Cannot access storage", e);
            }
        }
        return result;
    }

    protected class AppendTemplate {
        private final String aggregateId;
        private final long expectedVersion;
        private final List<Event> events = new ArrayList<>();
        private final List<String> bodies = new ArrayList<>();
        private final List<String> headers = new ArrayList<>();
        private final Set<UUID> uuids = new LinkedHashSet<>();

        protected AppendTemplate(String aggregateId, long expectedVersion) {
            if (aggregateId == null) {
                throw new IllegalArgumentException("Aggregate id must be specified");
            }
            this.aggregateId = aggregateId;
            this.expectedVersion = expectedVersion;
        }

        void addEvent(Event event) throws EventStoreException {
            if (event.isCommitted()) {
                throw EventStoreException.alreadyCommitted(aggregateId, event);
            }
            if (event.aggregateId() != null && !aggregateId.equals(event.aggregateId())) {
                throw EventStoreException.multipleAggregates(aggregateId, event);
            }
            if (!uuids.add(event.uuid())) {
                throw EventStoreException.duplicate(aggregateId, event.uuid());
            }
            try {
                bodies.add(serialization.serialize(event.body()));
                headers.add(serialization.serialize(event.headers()));
            } catch (IllegalArgumentException e) {
                throw EventStoreException.unsupported(event, e);
            }
            events.add(event);
        }

        public List<Event> append() throws EventStoreException {
            if (events.isEmpty()) {
                return Collections.emptyList();
            }
            Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            try (Connection connection = dataSource.getConnection()) {
                boolean autoCommit = connection.getAutoCommit();
                connection.setAutoCommit(false);
                try {
                    List<Event> committed = write(connection, createdAt);
                    connection.commit();
                    logger.debug("Appended {} events to {}, last id {}", committed.size(), aggregateId,
                        committed.get(committed.size() - 1).id());
                    return committed;
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                } finally {
                    restoreAutoCommit(connection, autoCommit);
                }
            } catch (SQLException ex) {
                if (schema.isUniqueViolation(ex)) {
                    throw classifyConflict(ex);
                }
                throw EventStoreException.storeFailed(aggregateId, ex);
            }
        }

        private List<Event> write(Connection connection, Instant createdAt) throws SQLException, EventStoreException {
            if (lockForAppend) {
                acquireLock(connection);
            }
            long currentVersion = readOrCreateVersion(connection);
            if (expectedVersion != ANY_VERSION && currentVersion != expectedVersion) {
                throw EventStoreException.optimisticLock(aggregateId, currentVersion, expectedVersion);
            }
            checkDuplicates(connection);
            List<Event> committed = insertEvents(connection, currentVersion, createdAt);
            updateVersion(connection, currentVersion, currentVersion + events.size());
            announce(connection, committed.get(committed.size() - 1).id());
            return committed;
        }

        private void acquireLock(Connection connection) throws SQLException {
            try (PreparedStatement lock = schema.lockForAppend(connection);
                    ResultSet rs = lock.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Append lock row is missing");
                }
            }
        }

        private long readOrCreateVersion(Connection connection) throws SQLException {
            try (PreparedStatement selectVersion = schema.selectAggregateVersion(connection, aggregateId);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (rs.next()) {
                    return schema.readAggregateVersion(rs);
                }
            }
            // no aggregate version - create a new one.
            try (PreparedStatement createVersion = schema.createAggregateVersion(connection, aggregateId)) {
                createVersion.executeUpdate();
            }
            return 0;
        }

        private void checkDuplicates(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement st = schema.selectExistingUuids(connection, uuids);
                    ResultSet rs = st.executeQuery()) {
                if (rs.next()) {
                    throw EventStoreException.duplicate(aggregateId, schema.readUuid(rs));
                }
            }
        }

        private List<Event> insertEvents(Connection connection, long startVersion, Instant createdAt)
                throws SQLException {
            List<Event> committed = new ArrayList<>(events.size());
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                long version = startVersion;
                for (int i = 0; i < events.size(); i++) {
                    Event event = events.get(i);
                    version++;
                    schema.prepareInsert(insertEvent, event, aggregateId, version, createdAt, bodies.get(i),
                        headers.get(i));
                    insertEvent.executeUpdate();
                    try (ResultSet keys = insertEvent.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No id generated for event " + event.uuid());
                        }
                        committed.add(event.committed(schema.readGeneratedId(keys), aggregateId, version,
                            createdAt));
                    }
                }
            }
            return committed;
        }

        private void updateVersion(Connection connection, long startVersion, long endVersion)
                throws SQLException, EventStoreException {
            try (PreparedStatement updateVersion = schema.updateAggregateVersion(connection, aggregateId,
                startVersion, endVersion)) {
                if (updateVersion.executeUpdate() != 1) {
                    throw EventStoreException.optimisticLock(aggregateId, -1, startVersion);
                }
            }
        }

        private void announce(Connection connection, long lastEventId) throws SQLException {
            try (PreparedStatement st = schema.notifyNewEvents(connection, lastEventId)) {
                if (st != null) {
                    st.execute();
                }
            }
        }

        private void rollback(Connection connection, Exception cause) {
            try {
                connection.rollback();
            } catch (SQLException e) {
                cause.addSuppressed(e);
            }
        }

        private void restoreAutoCommit(Connection connection, boolean autoCommit) {
            try {
                connection.setAutoCommit(autoCommit);
            } catch (SQLException e) {
                logger.warn("Cannot restore auto commit of connection", e);
            }
        }

        /**
         * Unique constraint failed, either on event uuid, or on aggregate version by concurrent writer.
         */
        private EventStoreException classifyConflict(SQLException cause) {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement st = schema.selectExistingUuids(connection, uuids);
                    ResultSet rs = st.executeQuery()) {
                if (rs.next()) {
                    return new DuplicateEventException(aggregateId, schema.readUuid(rs), cause);
                }
                return new ConcurrencyException(aggregateId, readAggregateVersion(connection, aggregateId),
                    expectedVersion, cause);
            } catch (SQLException e) {
                cause.addSuppressed(e);
                return EventStoreException.storeFailed(aggregateId, cause);
            }
        }
    }
}
