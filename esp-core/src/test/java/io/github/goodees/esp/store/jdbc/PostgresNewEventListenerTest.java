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
import io.github.goodees.esp.core.store.NewEventNotifier;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.esp.core.Eventually.await;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

public class PostgresNewEventListenerTest extends JdbcTest {
    private final NewEventNotifier notifier = new NewEventNotifier();
    private final BlockingQueue<Long> announced = new LinkedBlockingQueue<>();
    private ScriptedListener listener;

    @Before
    public void startListener() {
        notifier.register(announced::add);
        listener = new ScriptedListener(notifier);
    }

    @After
    public void stopListener() {
        listener.close();
    }

    @Test
    public void notifications_wake_local_listeners() throws InterruptedException {
        listener.start();
        listener.script.add(new PGNotification[] { notification("new_event", "7"), notification("new_event", "9") });

        assertEquals(Long.valueOf(9), announced.poll(5, TimeUnit.SECONDS));
        assertNull(announced.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    public void foreign_and_malformed_notifications_are_ignored() throws InterruptedException {
        listener.start();
        listener.script.add(new PGNotification[] { notification("other", "12"), notification("new_event", "abc"),
                notification("new_event", null) });
        listener.script.add(new PGNotification[] { notification("new_event", " 15 ") });

        assertEquals(Long.valueOf(15), announced.poll(5, TimeUnit.SECONDS));
    }

    @Test
    public void failed_connection_is_reopened() throws InterruptedException {
        listener.start();
        listener.script.add(new SQLException("Connection lost"));
        listener.script.add(new PGNotification[] { notification("new_event", "3") });

        assertEquals(Long.valueOf(3), announced.poll(5, TimeUnit.SECONDS));
        assertEquals(2, listener.listens.get());
    }

    @Test
    public void close_stops_listening() throws InterruptedException {
        listener.start();
        await("listener subscribes to channel", () -> listener.listens.get() == 1);

        listener.close();

        assertFalse(listener.isRunning());
    }

    @Test(expected = IllegalStateException.class)
    public void listener_starts_only_once() {
        listener.start();
        listener.start();
    }

    @Test(expected = IllegalArgumentException.class)
    public void channel_name_must_be_plain_identifier() {
        new PostgresNewEventListener(ds, "new_event; drop table events", notifier, Duration.ofSeconds(1),
                Duration.ofSeconds(1));
    }

    @Test
    public void schema_announces_on_configured_channel() {
        PostgresJdbcSchema postgres = new PostgresJdbcSchema(EspConfiguration.defaults());
        assertEquals(PostgresJdbcSchema.DEFAULT_CHANNEL, postgres.getChannel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void schema_rejects_invalid_channel() {
        new PostgresJdbcSchema(EspConfiguration.defaults(), "New Event");
    }

    private static PGNotification notification(String name, String parameter) {
        return new PGNotification() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public int getPID() {
                return 42;
            }

            @Override
            public String getParameter() {
                return parameter;
            }
        };
    }

    /**
     * Receives notifications from a script instead of PostgreSQL connection.
     */
    static class ScriptedListener extends PostgresNewEventListener {
        final BlockingQueue<Object> script = new LinkedBlockingQueue<>();
        final AtomicInteger listens = new AtomicInteger();

        ScriptedListener(NewEventNotifier notifier) {
            super(ds, PostgresJdbcSchema.DEFAULT_CHANNEL, notifier, Duration.ofMillis(50), Duration.ofMillis(50));
        }

        @Override
        protected void listen(Connection connection) {
            listens.incrementAndGet();
        }

        @Override
        protected PGNotification[] receive(Connection connection, int timeoutMillis) throws SQLException {
            Object next;
            try {
                next = script.poll(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SQLException("Interrupted", e);
            }
            if (next instanceof SQLException) {
                throw (SQLException) next;
            }
            return (PGNotification[]) next;
        }
    }
}
