package eventsync.jdbc.log;

import java.util.List;

/**
 * MySQL event log. Also compatible with MariaDB and TiDB.
 */
public final class MySqlEventLog extends AbstractJdbcEventLog {

  public MySqlEventLog() {
    super();
  }

  public MySqlEventLog(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcEventLog withTableName(String tableName) {
    return new MySqlEventLog(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
