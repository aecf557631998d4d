package eventsync.jdbc.purge;

import eventsync.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * MySQL event purger. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery on the same table, so this
 * uses {@code DELETE ... ORDER BY ... LIMIT} instead.
 */
public final class MySqlEventPurger extends AbstractJdbcEventPurger {

  public MySqlEventPurger() {
    super();
  }

  public MySqlEventPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE expires_at < ?" +
        " ORDER BY expires_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
