/**
 * Database-backed presence records shared by every process using the same database.
 */
package eventsync.jdbc.presence;
