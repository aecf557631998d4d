/**
 * Client side of the sync protocol: the reconnecting state machine, deduplication and
 * per-type event dispatch.
 */
package eventsync.client;
