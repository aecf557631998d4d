package eventsync.jdbc.purge;

import eventsync.jdbc.log.AbstractJdbcEventLog;

/**
 * Picks the purger matching an event log's dialect.
 */
public final class JdbcEventPurgers {
  private JdbcEventPurgers() {
  }

  /**
   * Returns a purger for the log's database, deleting from the log's table.
   *
   * @param log the event log
   * @return a purger of the same dialect
   */
  public static AbstractJdbcEventPurger forLog(AbstractJdbcEventLog log) {
    return switch (log.name()) {
      case "mysql" -> new MySqlEventPurger(log.tableName());
      case "postgresql" -> new PostgresEventPurger(log.tableName());
      default -> new H2EventPurger(log.tableName());
    };
  }
}
