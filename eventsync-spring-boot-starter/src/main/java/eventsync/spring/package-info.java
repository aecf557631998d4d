/**
 * Spring integration: transaction-bound emission and the WebSocket transport for sync sessions.
 */
package eventsync.spring;
