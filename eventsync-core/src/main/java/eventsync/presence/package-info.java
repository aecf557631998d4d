/**
 * Ephemeral per-entity presence with a time-to-live.
 */
package eventsync.presence;
