package eventsync.jdbc.sequence;

import eventsync.jdbc.EventSyncStoreException;
import eventsync.jdbc.JdbcTemplate;
import eventsync.jdbc.TableNames;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.SequenceService;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SequenceService} backed by a shared counter table, safe for any number of processes
 * writing to the same database.
 *
 * <p>Each allocation runs {@code UPDATE ... SET last_value = last_value + 1} followed by a
 * {@code SELECT} in one transaction; the row lock taken by the update serializes concurrent
 * allocators. The first allocation for a tenant inserts the counter row seeded from
 * {@code MAX(sequence_number)} of the event log, and a lost insert race (unique key violation,
 * SQL state class {@code 23}) is retried.
 *
 * <p>Use {@link #forDialect} to get the single-statement PostgreSQL variant where available.
 */
public class JdbcSequenceService implements SequenceService {
  private static final Logger logger = Logger.getLogger(JdbcSequenceService.class.getName());
  private static final int MAX_ATTEMPTS = 5;

  private final ConnectionProvider connectionProvider;
  private final String sequenceTable;
  private final String eventTable;

  public JdbcSequenceService(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_SEQUENCE_TABLE, TableNames.DEFAULT_EVENT_TABLE);
  }

  /**
   * @param connectionProvider source of connections; each allocation borrows one
   * @param sequenceTable counter table name
   * @param eventTable event log table, read once per tenant to seed its counter
   */
  public JdbcSequenceService(ConnectionProvider connectionProvider, String sequenceTable, String eventTable) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.sequenceTable = TableNames.validate(sequenceTable);
    this.eventTable = TableNames.validate(eventTable);
  }

  /**
   * Creates the sequence service suited to a database.
   *
   * @param dialect event log name ("h2", "mysql", "postgresql")
   * @param connectionProvider source of connections
   * @param sequenceTable counter table name
   * @param eventTable event log table name
   * @return a sequence service for that database
   */
  public static JdbcSequenceService forDialect(String dialect, ConnectionProvider connectionProvider,
      String sequenceTable, String eventTable) {
    Objects.requireNonNull(dialect, "dialect");
    if ("postgresql".equals(dialect)) {
      return new PostgresSequenceService(connectionProvider, sequenceTable, eventTable);
    }
    return new JdbcSequenceService(connectionProvider, sequenceTable, eventTable);
  }

  protected String sequenceTable() {
    return sequenceTable;
  }

  protected String eventTable() {
    return eventTable;
  }

  @Override
  public long nextSequence(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    for (int attempt = 1; ; attempt++) {
      try (Connection conn = connectionProvider.getConnection()) {
        return allocate(conn, tenantId);
      } catch (SQLException e) {
        throw new EventSyncStoreException("Failed to allocate sequence for tenantId=" + tenantId, e);
      } catch (EventSyncStoreException e) {
        if (!isUniqueViolation(e) || attempt >= MAX_ATTEMPTS) {
          throw e;
        }
        logger.log(Level.FINE, "Lost counter insert race for tenant {0}, retrying", tenantId);
      }
    }
  }

  @Override
  public long currentSequence(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    try (Connection conn = connectionProvider.getConnection()) {
      String sql = "SELECT last_value FROM " + sequenceTable + " WHERE tenant_id=?";
      return JdbcTemplate.queryForLong(conn, sql, tenantId).orElseGet(() -> seed(conn, tenantId));
    } catch (SQLException e) {
      throw new EventSyncStoreException("Failed to read sequence for tenantId=" + tenantId, e);
    }
  }

  /**
   * Allocates the next value on {@code conn}.
   *
   * @param conn a borrowed connection, closed by the caller
   * @param tenantId the tenant
   * @return the allocated sequence number
   * @throws SQLException on transaction control failures
   */
  protected long allocate(Connection conn, String tenantId) throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      long value;
      String increment = "UPDATE " + sequenceTable + " SET last_value=last_value+1 WHERE tenant_id=?";
      if (JdbcTemplate.update(conn, increment, tenantId) > 0) {
        String select = "SELECT last_value FROM " + sequenceTable + " WHERE tenant_id=?";
        value = JdbcTemplate.queryForLong(conn, select, tenantId)
            .orElseThrow(() -> new IllegalStateException("Counter row vanished for tenantId=" + tenantId));
      } else {
        value = seed(conn, tenantId) + 1;
        String insert = "INSERT INTO " + sequenceTable + " (tenant_id, last_value) VALUES (?,?)";
        JdbcTemplate.update(conn, insert, tenantId, value);
        logger.log(Level.FINE, "Created sequence counter for tenant {0} at {1}", new Object[]{tenantId, value});
      }
      conn.commit();
      return value;
    } catch (SQLException | RuntimeException e) {
      rollback(conn, e);
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  /**
   * Highest sequence number already in the event log for a tenant, or 0.
   */
  protected long seed(Connection conn, String tenantId) {
    String sql = "SELECT MAX(sequence_number) FROM " + eventTable + " WHERE tenant_id=?";
    return JdbcTemplate.queryForLong(conn, sql, tenantId).orElse(0L);
  }

  private static boolean isUniqueViolation(EventSyncStoreException e) {
    String state = e.sqlState();
    return state != null && state.startsWith("23");
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
