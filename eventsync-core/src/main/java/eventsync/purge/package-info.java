/**
 * Scheduled retention purge.
 */
package eventsync.purge;
