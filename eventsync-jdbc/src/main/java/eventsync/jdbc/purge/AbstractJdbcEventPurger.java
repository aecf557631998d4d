package eventsync.jdbc.purge;

import eventsync.jdbc.JdbcTemplate;
import eventsync.jdbc.TableNames;
import eventsync.spi.EventPurger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Base JDBC event purger with default subquery-based SQL that works for H2
 * and PostgreSQL.
 *
 * <p>Subclasses may override {@link #purge} for databases that support more
 * efficient syntax (e.g. MySQL supports {@code DELETE ... ORDER BY ... LIMIT}).
 *
 * @see H2EventPurger
 * @see MySqlEventPurger
 * @see PostgresEventPurger
 */
public abstract class AbstractJdbcEventPurger implements EventPurger {
  private final String tableName;

  protected AbstractJdbcEventPurger() {
    this(TableNames.DEFAULT_EVENT_TABLE);
  }

  protected AbstractJdbcEventPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  /**
   * Deletes events whose retention ended before {@code before}, oldest first, up to
   * {@code limit} rows.
   */
  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE event_id IN (" +
        "SELECT event_id FROM " + tableName() +
        " WHERE expires_at < ?" +
        " ORDER BY expires_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
