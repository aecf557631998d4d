/**
 * Server side of the sync protocol: per-connection sessions and keep-alive.
 */
package eventsync.server;
