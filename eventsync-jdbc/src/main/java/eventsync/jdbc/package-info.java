/**
 * JDBC persistence for the event log, retention purge, shared sequence counters and shared
 * presence.
 *
 * <p>Database-specific classes live in {@link eventsync.jdbc.log}, {@link eventsync.jdbc.purge},
 * {@link eventsync.jdbc.sequence} and {@link eventsync.jdbc.presence}. DDL for H2, MySQL and PostgreSQL ships as classpath
 * resources under {@code eventsync/schema/}.
 */
package eventsync.jdbc;
