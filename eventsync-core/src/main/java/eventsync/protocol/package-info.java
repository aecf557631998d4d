/**
 * JSON wire protocol shared by the server session and the client.
 */
package eventsync.protocol;
