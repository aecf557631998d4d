package eventsync.jdbc.log;

import java.util.List;

/**
 * PostgreSQL event log.
 */
public final class PostgresEventLog extends AbstractJdbcEventLog {

  public PostgresEventLog() {
    super();
  }

  public PostgresEventLog(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcEventLog withTableName(String tableName) {
    return new PostgresEventLog(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
