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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.regex.Pattern;

/**
 * Schema for PostgreSQL. Every append sends {@code NOTIFY} on a channel with id of the last appended event as
 * payload, so that {@link PostgresNewEventListener} in other processes can wake their subscriptions.
 */
public class PostgresJdbcSchema extends DefaultJdbcSchema {
    public static final String DEFAULT_CHANNEL = "new_event";

    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final String channel;

    public PostgresJdbcSchema(EspConfiguration configuration) {
        this(configuration, DEFAULT_CHANNEL);
    }

    public PostgresJdbcSchema(EspConfiguration configuration, String channel) {
        super(configuration);
        this.channel = requireChannelName(channel);
    }

    public String getChannel() {
        return channel;
    }

    @Override
    protected PreparedStatement notifyNewEvents(Connection connection, long lastEventId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT pg_notify(?, ?)");
        st.setString(1, channel);
        st.setString(2, Long.toString(lastEventId));
        return st;
    }

    /**
     * Channel names end up in {@code LISTEN} statement, which cannot take parameters.
     */
    static String requireChannelName(String channel) {
        if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: " + channel);
        }
        return channel;
    }
}
