/**
 * In-process sequence allocation.
 */
package eventsync.sequence;
