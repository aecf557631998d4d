package eventsync.jdbc;

import java.util.Objects;

/**
 * Shared table name defaults and validation for the JDBC components.
 */
public final class TableNames {
  public static final String DEFAULT_EVENT_TABLE = "sync_event_log";
  public static final String DEFAULT_SEQUENCE_TABLE = "sync_sequence";
  public static final String DEFAULT_PRESENCE_TABLE = "sync_presence";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
