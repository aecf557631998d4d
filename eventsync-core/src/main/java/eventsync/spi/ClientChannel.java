package eventsync.spi;

import java.io.IOException;

/**
 * Server side of a live, bidirectional transport to one client (a WebSocket, for example).
 *
 * <p>{@link #send} is only ever called by one thread at a time per channel.
 */
public interface ClientChannel {

  /**
   * Returns a stable identifier of this channel, unique within the process.
   *
   * @return the channel id
   */
  String id();

  boolean isOpen();

  /**
   * Writes one text frame.
   *
   * @param text the frame
   * @throws IOException if the transport failed or is closed
   */
  void send(String text) throws IOException;

  /**
   * Closes the transport. Implementations must tolerate repeated calls.
   */
  void close();
}
