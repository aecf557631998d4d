/**
 * Durable event log implementations per database, discovered through {@link java.util.ServiceLoader}.
 */
package eventsync.jdbc.log;
