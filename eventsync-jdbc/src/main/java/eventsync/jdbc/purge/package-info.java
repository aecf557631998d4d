/**
 * Batched deletion of events past their retention boundary.
 *
 * @see eventsync.purge.EventPurgeScheduler
 */
package eventsync.jdbc.purge;
