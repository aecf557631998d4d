package eventsync.jdbc.sequence;

import eventsync.jdbc.JdbcTemplate;
import eventsync.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * PostgreSQL sequence service.
 *
 * <p>Allocates with a single {@code INSERT ... ON CONFLICT DO UPDATE ... RETURNING}: the
 * first call for a tenant inserts {@code MAX(sequence_number) + 1} from the event log, later
 * calls increment the existing row. No explicit transaction and no retry are needed.
 */
public final class PostgresSequenceService extends JdbcSequenceService {

  public PostgresSequenceService(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public PostgresSequenceService(ConnectionProvider connectionProvider, String sequenceTable, String eventTable) {
    super(connectionProvider, sequenceTable, eventTable);
  }

  @Override
  protected long allocate(Connection conn, String tenantId) throws SQLException {
    String sql = "INSERT INTO " + sequenceTable() + " (tenant_id, last_value) VALUES (?, " +
        "COALESCE((SELECT MAX(sequence_number) FROM " + eventTable() + " WHERE tenant_id=?), 0) + 1) " +
        "ON CONFLICT (tenant_id) DO UPDATE SET last_value=" + sequenceTable() + ".last_value+1 " +
        "RETURNING last_value";
    long value = JdbcTemplate.updateReturningLong(conn, sql, tenantId, tenantId);
    if (!conn.getAutoCommit()) {
      conn.commit();
    }
    return value;
  }
}
