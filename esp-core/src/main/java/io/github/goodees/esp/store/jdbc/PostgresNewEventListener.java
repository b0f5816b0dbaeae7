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

import io.github.goodees.esp.core.store.NewEventNotifier;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Receives notifications sent by {@link PostgresJdbcSchema} on appends in any process, and passes them to local
 * {@link NewEventNotifier}. Subscriptions using {@link io.github.goodees.esp.core.subscription.PushAssistedWaitStrategy}
 * on that notifier then wake up as soon as events are committed elsewhere.
 *
 * <p>The listener holds one connection of the data source for its whole lifetime, and reconnects when the connection
 * fails. Notifications sent while reconnecting are lost, subscriptions find those events on their next poll.
 */
public class PostgresNewEventListener implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PostgresNewEventListener.class);

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    private final DataSource dataSource;
    private final String channel;
    private final NewEventNotifier notifier;
    private final Duration pollTimeout;
    private final Duration reconnectDelay;
    private final CountDownLatch closed = new CountDownLatch(1);
    private Thread thread;

    public PostgresNewEventListener(DataSource dataSource, NewEventNotifier notifier) {
        this(dataSource, PostgresJdbcSchema.DEFAULT_CHANNEL, notifier, DEFAULT_POLL_TIMEOUT, DEFAULT_RECONNECT_DELAY);
    }

    public PostgresNewEventListener(DataSource dataSource, String channel, NewEventNotifier notifier,
            Duration pollTimeout, Duration reconnectDelay) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.channel = PostgresJdbcSchema.requireChannelName(channel);
        this.notifier = Objects.requireNonNull(notifier, "Notifier must be specified");
        this.pollTimeout = Objects.requireNonNull(pollTimeout);
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay);
    }

    /**
     * Start listening on background daemon thread.
     * @throws IllegalStateException when started for second time
     */
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Listener on channel " + channel + " was already started");
        }
        thread = new Thread(this::listenUntilClosed, "esp-listener-" + channel);
        thread.setDaemon(true);
        thread.start();
    }

    public synchronized boolean isRunning() {
        return thread != null && thread.isAlive();
    }

    private boolean isClosed() {
        return closed.getCount() == 0;
    }

    private void listenUntilClosed() {
        while (!isClosed()) {
            try (Connection connection = dataSource.getConnection()) {
                listen(connection);
                logger.info("Listening for new events on channel {}", channel);
                while (!isClosed()) {
                    PGNotification[] notifications = receive(connection, (int) pollTimeout.toMillis());
                    if (notifications != null) {
                        dispatch(notifications);
                    }
                }
            } catch (SQLException e) {
                if (isClosed()) {
                    break;
                }
                logger.warn("Listening on channel {} failed, reconnecting in {}", channel, reconnectDelay, e);
                try {
                    closed.await(reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.info("Stopped listening on channel {}", channel);
    }

    /**
     * Subscribe the connection to the channel.
     */
    protected void listen(Connection connection) throws SQLException {
        // notifications are delivered only outside of transaction
        if (!connection.getAutoCommit()) {
            connection.setAutoCommit(true);
        }
        try (Statement st = connection.createStatement()) {
            st.execute("LISTEN " + channel);
        }
    }

    /**
     * Wait for notifications.
     * @return received notifications, empty or null when none arrived within the timeout
     */
    protected PGNotification[] receive(Connection connection, int timeoutMillis) throws SQLException {
        return connection.unwrap(PGConnection.class).getNotifications(timeoutMillis);
    }

    private void dispatch(PGNotification[] notifications) {
        long latestId = 0;
        for (PGNotification notification : notifications) {
            if (!channel.equals(notification.getName())) {
                continue;
            }
            String payload = notification.getParameter();
            try {
                latestId = Math.max(latestId, Long.parseLong(payload == null ? "" : payload.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring notification on channel {} with payload '{}'", channel, payload);
            }
        }
        if (latestId > 0) {
            logger.debug("Events up to {} were appended", latestId);
            notifier.eventsAppended(latestId);
        }
    }

    /**
     * Stop listening and wait for the listening thread to finish.
     */
    @Override
    public void close() {
        closed.countDown();
        Thread listening;
        synchronized (this) {
            listening = thread;
        }
        if (listening == null || listening == Thread.currentThread()) {
            return;
        }
        try {
            listening.join(pollTimeout.toMillis() + reconnectDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (listening.isAlive()) {
            logger.warn("Listener on channel {} did not stop in time", channel);
        }
    }
}
