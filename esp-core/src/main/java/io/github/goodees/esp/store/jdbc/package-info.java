/**
 * Event store and checkpoint tracker backed by a relational database accessed via plain JDBC.
 *
 * <p>SQL is isolated in {@link io.github.goodees.esp.store.jdbc.JdbcSchema}, so that table layout and dialect
 * can be adapted by subclassing {@link io.github.goodees.esp.store.jdbc.DefaultJdbcSchema}.
 * <p>On PostgreSQL, {@link io.github.goodees.esp.store.jdbc.PostgresJdbcSchema} together with
 * {@link io.github.goodees.esp.store.jdbc.PostgresNewEventListener} wake subscriptions in other processes on append.
 */
package io.github.goodees.esp.store.jdbc;
