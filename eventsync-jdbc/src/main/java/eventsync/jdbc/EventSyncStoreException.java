package eventsync.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the log, purger and sequence
 * implementations.
 */
public final class EventSyncStoreException extends RuntimeException {
  public EventSyncStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the SQL state of the wrapped {@link SQLException}, or {@code null}.
   *
   * @return the SQL state
   */
  public String sqlState() {
    return getCause() instanceof SQLException e ? e.getSQLState() : null;
  }
}
