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
import io.github.goodees.esp.core.store.PayloadSerialization;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.TimeZone;
import java.util.UUID;

/**
 * JDBC schema with single table for all events. Following tables are expected to exist:
 * <ul>
 * <li><em>eventsTable</em>(ID bigint generated by default as identity primary key, UUID varchar(36) unique,
 * AGGREGATE_ID varchar, VERSION bigint, TYPE varchar, BODY clob, HEADERS clob, CREATED_AT timestamp),
 * unique (AGGREGATE_ID, VERSION)</li>
 * <li><em>aggregatesTable</em>(ID varchar primary key, VERSION bigint)</li>
 * <li><em>trackerTable</em>(NAME varchar primary key, LAST_PROCESSED_EVENT_ID bigint)</li>
 * <li><em>lockTable</em>(ID int primary key) with single row {@code ID = 1}</li>
 * </ul>
 * <p>Queries use {@code SELECT ... FOR UPDATE} and {@code FETCH FIRST n ROWS ONLY}, which both H2 and PostgreSQL
 * understand. {@code CREATED_AT} holds UTC time regardless of time zone of the JVM or the database session.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "ID, UUID, AGGREGATE_ID, VERSION, TYPE, BODY, HEADERS, CREATED_AT";

    private final String eventsTable;
    private final String aggregatesTable;
    private final String trackerTable;
    private final String lockTable;

    public DefaultJdbcSchema(String eventsTable, String aggregatesTable, String trackerTable, String lockTable) {
        this.eventsTable = eventsTable;
        this.aggregatesTable = aggregatesTable;
        this.trackerTable = trackerTable;
        this.lockTable = lockTable;
    }

    public DefaultJdbcSchema(EspConfiguration configuration) {
        this(configuration.getEventsTableName(), configuration.getAggregatesTableName(),
            configuration.getTrackerTableName(), configuration.getLockTableName());
    }

    protected String getEventsTable() {
        return eventsTable;
    }

    protected String getAggregatesTable() {
        return aggregatesTable;
    }

    protected String getTrackerTable() {
        return trackerTable;
    }

    protected String getLockTable() {
        return lockTable;
    }

    @Override
    protected PreparedStatement lockForAppend(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT ID FROM " + getLockTable() + " WHERE ID = 1 FOR UPDATE");
    }

    @Override
    protected PreparedStatement selectAggregateVersion(Connection connection, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getAggregatesTable()
                + " WHERE ID=?");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected long readAggregateVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createAggregateVersion(Connection connection, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getAggregatesTable()
                + " (ID, VERSION) VALUES (?, 0)");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement updateAggregateVersion(Connection connection, String aggregateId, long startVersion,
            long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getAggregatesTable()
                + " SET VERSION=? WHERE ID=? AND VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, aggregateId);
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectExistingUuids(Connection connection, Collection<UUID> uuids)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT UUID FROM " + getEventsTable()
                + " WHERE UUID IN (" + placeholders(uuids.size()) + ")");
        int i = 1;
        for (UUID uuid : uuids) {
            st.setString(i++, uuid.toString());
        }
        return st;
    }

    @Override
    protected UUID readUuid(ResultSet rs) throws SQLException {
        return UUID.fromString(rs.getString(1));
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventsTable()
                + " (UUID, AGGREGATE_ID, VERSION, TYPE, BODY, HEADERS, CREATED_AT) VALUES (?,?,?,?,?,?,?)",
            Statement.RETURN_GENERATED_KEYS);
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, Event event, String aggregateId, long version,
            Instant createdAt, String body, String headers) throws SQLException {
        insertEvent.setString(1, event.uuid().toString());
        insertEvent.setString(2, aggregateId);
        insertEvent.setLong(3, version);
        insertEvent.setString(4, event.type());
        insertEvent.setString(5, body);
        insertEvent.setString(6, headers);
        insertEvent.setTimestamp(7, Timestamp.from(createdAt), utc());
    }

    @Override
    protected long readGeneratedId(ResultSet generatedKeys) throws SQLException {
        // H2 returns the identity column only, PostgreSQL the whole row
        return generatedKeys.getLong("ID");
    }

    @Override
    protected PreparedStatement selectEventsAfter(Connection connection, long cursorId, Collection<String> eventTypes,
            int limit) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventsTable()
                + " WHERE ID > ?" + typeCondition(" AND ", eventTypes) + " ORDER BY ID FETCH FIRST " + limit
                + " ROWS ONLY");
        st.setLong(1, cursorId);
        bindTypes(st, 2, eventTypes);
        return st;
    }

    @Override
    protected PreparedStatement selectEventsForAggregate(Connection connection, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventsTable()
                + " WHERE AGGREGATE_ID = ? ORDER BY ID");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement selectLatestId(Connection connection, Collection<String> eventTypes)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT MAX(ID) FROM " + getEventsTable()
                + typeCondition(" WHERE ", eventTypes));
        bindTypes(st, 1, eventTypes);
        return st;
    }

    @Override
    protected Event readEvent(ResultSet rs, PayloadSerialization serialization) throws SQLException {
        Timestamp createdAt = rs.getTimestamp(8, utc());
        return Event.builder()
                .id(rs.getLong(1))
                .uuid(UUID.fromString(rs.getString(2)))
                .aggregateId(rs.getString(3))
                .version(rs.getLong(4))
                .type(rs.getString(5))
                .body(serialization.deserialize(rs.getString(6)))
                .headers(serialization.deserialize(rs.getString(7)))
                .createdAt(createdAt == null ? null : createdAt.toInstant())
                .build();
    }

    @Override
    protected PreparedStatement selectCheckpoint(Connection connection, String processorName) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT LAST_PROCESSED_EVENT_ID FROM " + getTrackerTable()
                + " WHERE NAME = ?");
        st.setString(1, processorName);
        return st;
    }

    @Override
    protected long readCheckpoint(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createCheckpoint(Connection connection, String processorName, long eventId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getTrackerTable()
                + " (NAME, LAST_PROCESSED_EVENT_ID) VALUES (?, ?)");
        st.setString(1, processorName);
        st.setLong(2, eventId);
        return st;
    }

    @Override
    protected PreparedStatement advanceCheckpoint(Connection connection, String processorName, long eventId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getTrackerTable()
                + " SET LAST_PROCESSED_EVENT_ID = ? WHERE NAME = ? AND LAST_PROCESSED_EVENT_ID <= ?");
        st.setLong(1, eventId);
        st.setString(2, processorName);
        st.setLong(3, eventId);
        return st;
    }

    @Override
    protected PreparedStatement resetCheckpoint(Connection connection, String processorName) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getTrackerTable()
                + " SET LAST_PROCESSED_EVENT_ID = 0 WHERE NAME = ?");
        st.setString(1, processorName);
        return st;
    }

    @Override
    protected PreparedStatement selectTrackedProcessors(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT NAME FROM " + getTrackerTable() + " ORDER BY NAME");
    }

    private static Calendar utc() {
        return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
    }

    private static String typeCondition(String prefix, Collection<String> eventTypes) {
        if (eventTypes.isEmpty()) {
            return "";
        }
        return prefix + "TYPE IN (" + placeholders(eventTypes.size()) + ")";
    }

    private static void bindTypes(PreparedStatement st, int firstIndex, Collection<String> eventTypes)
            throws SQLException {
        int i = firstIndex;
        for (String type : eventTypes) {
            st.setString(i++, type);
        }
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
