/**
 * Database-backed per-tenant sequence counters shared by every process using the same database.
 */
package eventsync.jdbc.sequence;
