package eventsync.jdbc.log;

import java.util.List;

/**
 * H2 event log. Primarily for testing.
 */
public final class H2EventLog extends AbstractJdbcEventLog {

  public H2EventLog() {
    super();
  }

  public H2EventLog(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcEventLog withTableName(String tableName) {
    return new H2EventLog(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
