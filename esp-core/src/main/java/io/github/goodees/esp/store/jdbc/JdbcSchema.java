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
import io.github.goodees.esp.core.store.PayloadSerialization;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

/**
 * SQL dialect and table layout used by {@link JdbcEventStore} and {@link JdbcCheckpointTracker}.
 *
 * <p>Methods returning statements only prepare them and bind parameters, execution is left to the caller. This lets
 * subclasses adapt the SQL to specific database, or wrap statements in tests.
 */
public abstract class JdbcSchema {
    protected static final String UNIQUE_VIOLATION = "23505";

    // append path

    /**
     * Statement acquiring the append lock. Executing the query must block until the lock is available, and the lock
     * must be held until end of transaction.
     */
    protected abstract PreparedStatement lockForAppend(Connection connection) throws SQLException;

    protected abstract PreparedStatement selectAggregateVersion(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract long readAggregateVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createAggregateVersion(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract PreparedStatement updateAggregateVersion(Connection connection, String aggregateId,
            long startVersion, long endVersion) throws SQLException;

    protected abstract PreparedStatement selectExistingUuids(Connection connection, Collection<UUID> uuids)
            throws SQLException;

    protected abstract UUID readUuid(ResultSet rs) throws SQLException;

    /**
     * Prepare insert statement, that returns generated id of the event as generated key.
     */
    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, Event event, String aggregateId, long version,
            Instant createdAt, String body, String headers) throws SQLException;

    protected abstract long readGeneratedId(ResultSet generatedKeys) throws SQLException;

    /**
     * Statement announcing new events to subscribers in other processes. It runs inside the append transaction, so
     * the announcement is delivered only if the events commit.
     * @param lastEventId id of the last appended event
     * @return the statement, or null when the database offers no notification channel
     */
    protected PreparedStatement notifyNewEvents(Connection connection, long lastEventId) throws SQLException {
        return null;
    }

    // read path

    protected abstract PreparedStatement selectEventsAfter(Connection connection, long cursorId,
            Collection<String> eventTypes, int limit) throws SQLException;

    protected abstract PreparedStatement selectEventsForAggregate(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract PreparedStatement selectLatestId(Connection connection, Collection<String> eventTypes)
            throws SQLException;

    protected abstract Event readEvent(ResultSet rs, PayloadSerialization serialization) throws SQLException;

    // checkpoints

    protected abstract PreparedStatement selectCheckpoint(Connection connection, String processorName)
            throws SQLException;

    protected abstract long readCheckpoint(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createCheckpoint(Connection connection, String processorName, long eventId)
            throws SQLException;

    /**
     * Update checkpoint, unless the stored one is higher than {@code eventId}.
     */
    protected abstract PreparedStatement advanceCheckpoint(Connection connection, String processorName, long eventId)
            throws SQLException;

    protected abstract PreparedStatement resetCheckpoint(Connection connection, String processorName)
            throws SQLException;

    protected abstract PreparedStatement selectTrackedProcessors(Connection connection) throws SQLException;

    /**
     * Determine whether exception is violation of unique or primary key constraint.
     * @param e the exception
     * @return true for SQL state {@value #UNIQUE_VIOLATION}, as reported by H2 and PostgreSQL
     */
    protected boolean isUniqueViolation(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (UNIQUE_VIOLATION.equals(ex.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
