package eventsync.protocol;

/**
 * Thrown when a frame is not valid JSON or does not match any known message shape.
 */
public class ProtocolException extends RuntimeException {

  public ProtocolException(String message) {
    super(message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
