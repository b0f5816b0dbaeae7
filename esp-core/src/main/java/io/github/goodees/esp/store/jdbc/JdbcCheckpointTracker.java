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

import io.github.goodees.esp.core.config.EspConfiguration;
import io.github.goodees.esp.core.tracking.CheckpointRegressionException;
import io.github.goodees.esp.core.tracking.CheckpointTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Checkpoints stored in tracker table, one row per processor. Every update is committed before the method returns.
 *
 * <p>With automatic creation disabled, rows are only created by {@link #reset(String)}. Processors without a row read
 * checkpoint {@code 0} and fail on first {@link #advance(String, long)}.
 */
public class JdbcCheckpointTracker implements CheckpointTracker {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCheckpointTracker.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final boolean autoCreate;

    public JdbcCheckpointTracker(DataSource dataSource, EspConfiguration configuration) {
        this(dataSource, new DefaultJdbcSchema(configuration), configuration.isAutoCreateProcessorTracker());
    }

    public JdbcCheckpointTracker(DataSource dataSource, JdbcSchema schema, boolean autoCreate) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.autoCreate = autoCreate;
    }

    @Override
    public long lastProcessedId(String processorName) {
        return inAutoCommit(connection -> {
            OptionalLong stored = readCheckpoint(connection, processorName);
            if (stored.isPresent()) {
                return stored.getAsLong();
            }
            if (!autoCreate) {
                return 0L;
            }
            if (create(connection, processorName, 0)) {
                logger.info("Created checkpoint for processor {}", processorName);
                return 0L;
            }
            // created concurrently
            return readCheckpoint(connection, processorName).orElseThrow(() -> new IllegalStateException(
                    "Checkpoint of " + processorName + " disappeared"));
        });
    }

    @Override
    public void advance(String processorName, long eventId) {
        boolean created = inAutoCommit(connection -> {
            int updated;
            try (PreparedStatement st = schema.advanceCheckpoint(connection, processorName, eventId)) {
                updated = st.executeUpdate();
            }
            if (updated == 1) {
                return true;
            }
            OptionalLong stored = readCheckpoint(connection, processorName);
            if (stored.isPresent()) {
                throw new CheckpointRegressionException(processorName, stored.getAsLong(), eventId);
            }
            if (!autoCreate) {
                throw new IllegalStateException("Processor " + processorName
                        + " has no checkpoint and automatic creation is disabled");
            }
            return create(connection, processorName, eventId);
        });
        if (!created) {
            // lost the race for creation, the row exists now
            advance(processorName, eventId);
        }
    }

    @Override
    public void reset(String processorName) {
        inAutoCommit(connection -> {
            try (PreparedStatement st = schema.resetCheckpoint(connection, processorName)) {
                if (st.executeUpdate() == 0) {
                    create(connection, processorName, 0);
                }
            }
            return null;
        });
        logger.info("Checkpoint of processor {} reset", processorName);
    }

    @Override
    public Set<String> trackedProcessors() {
        return inAutoCommit(connection -> {
            Set<String> result = new LinkedHashSet<>();
            try (PreparedStatement st = schema.selectTrackedProcessors(connection);
                    ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString(1));
                }
            }
            return Collections.unmodifiableSet(result);
        });
    }

    /**
     * Run the work with auto commit on, so that every update is committed as it executes. The previous mode of the
     * connection is restored afterwards.
     */
    private <T> T inAutoCommit(Work<T> work) {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            if (!autoCommit) {
                connection.setAutoCommit(true);
            }
            try {
                return work.execute(connection);
            } finally {
                if (!autoCommit) {
                    restoreAutoCommit(connection);
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    private static void restoreAutoCommit(Connection connection) {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            logger.warn("Cannot restore auto commit of connection", e);
        }
    }

    @FunctionalInterface
    private interface Work<T> {
        T execute(Connection connection) throws SQLException;
    }

    private OptionalLong readCheckpoint(Connection connection, String processorName) throws SQLException {
        try (PreparedStatement st = schema.selectCheckpoint(connection, processorName);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? OptionalLong.of(schema.readCheckpoint(rs)) : OptionalLong.empty();
        }
    }

    /**
     * Insert checkpoint row.
     * @return false when the row already exists
     */
    private boolean create(Connection connection, String processorName, long eventId) throws SQLException {
        try (PreparedStatement st = schema.createCheckpoint(connection, processorName, eventId)) {
            st.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (schema.isUniqueViolation(e)) {
                return false;
            }
            throw e;
        }
    }
}
