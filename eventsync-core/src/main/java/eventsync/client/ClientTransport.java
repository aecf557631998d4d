package eventsync.client;

import java.io.IOException;

/**
 * Client end of a bidirectional text-frame channel, for example a WebSocket.
 *
 * <p>{@link SyncClient} opens a new connection on every (re)connect attempt and reports each
 * attempt's lifecycle through the listener passed to {@link #connect(TransportListener)}.
 */
public interface ClientTransport {

  /**
   * Starts opening a connection. Completion and failure are reported to {@code listener},
   * possibly on another thread.
   *
   * @param listener callbacks for this connection attempt
   */
  void connect(TransportListener listener);

  /**
   * Sends a text frame on the current connection.
   *
   * @param text the frame
   * @throws IOException if the connection is not open or the write fails
   */
  void send(String text) throws IOException;

  /** Closes the current connection, if any. */
  void close();
}
