/**
 * Local connection registry with per-connection send queues, and cross-process relaying.
 */
package eventsync.broadcast;
