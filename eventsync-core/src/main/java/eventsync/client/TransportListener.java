package eventsync.client;

/**
 * Lifecycle callbacks for one transport connection.
 */
public interface TransportListener {

  void onOpen();

  void onMessage(String text);

  /**
   * Called once when the connection ends or could not be opened.
   *
   * @param reason short description
   * @param error the cause, or {@code null} for an orderly close
   */
  void onClosed(String reason, Throwable error);
}
