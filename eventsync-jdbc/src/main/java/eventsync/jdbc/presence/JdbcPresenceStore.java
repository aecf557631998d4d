package eventsync.jdbc.presence;

import eventsync.jdbc.EventSyncStoreException;
import eventsync.jdbc.JdbcTemplate;
import eventsync.jdbc.TableNames;
import eventsync.presence.PresenceAction;
import eventsync.presence.PresenceKey;
import eventsync.presence.PresenceState;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.PresenceStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PresenceStore} backed by a shared table, so that every node of a cluster sees the same
 * presence records.
 *
 * <p>One row per {@code (tenant, entityType, entityId, user)}. An upsert locks the user's row
 * with {@code SELECT ... FOR UPDATE} and then updates or inserts it in one transaction; a lost
 * insert race (unique key violation, SQL state class {@code 23}) is retried. Reads filter on
 * {@code expires_at}, so expired rows are invisible until {@link #sweep(Instant)} deletes them.
 */
public class JdbcPresenceStore implements PresenceStore {
  private static final Logger logger = Logger.getLogger(JdbcPresenceStore.class.getName());
  private static final int MAX_ATTEMPTS = 5;
  private static final String COLUMNS = "user_id, user_name, entity_type, entity_id, action, updated_at";

  private final ConnectionProvider connectionProvider;
  private final String presenceTable;

  public JdbcPresenceStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_PRESENCE_TABLE);
  }

  /**
   * @param connectionProvider source of connections; each call borrows one
   * @param presenceTable presence table name
   */
  public JdbcPresenceStore(ConnectionProvider connectionProvider, String presenceTable) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.presenceTable = TableNames.validate(presenceTable);
  }

  @Override
  public PresenceState upsert(PresenceKey key, String userId, UnaryOperator<PresenceState> update,
      Duration ttl, Instant now) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(update, "update");
    for (int attempt = 1; ; attempt++) {
      try (Connection conn = connectionProvider.getConnection()) {
        return upsert(conn, key, userId, update, now.plus(ttl), now);
      } catch (SQLException e) {
        throw new EventSyncStoreException("Failed to store presence for " + key, e);
      } catch (EventSyncStoreException e) {
        if (!isUniqueViolation(e) || attempt >= MAX_ATTEMPTS) {
          throw e;
        }
        logger.log(Level.FINE, "Lost presence insert race for {0}, retrying", key);
      }
    }
  }

  private PresenceState upsert(Connection conn, PresenceKey key, String userId,
      UnaryOperator<PresenceState> update, Instant expiresAt, Instant now) throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      String select = "SELECT " + COLUMNS + ", expires_at FROM " + presenceTable
          + " WHERE tenant_id=? AND entity_type=? AND entity_id=? AND user_id=? FOR UPDATE";
      List<Row> rows = JdbcTemplate.query(conn, select, rs -> new Row(stateOf(rs), instantOf(rs, "expires_at")),
          key.tenantId(), key.entityType(), key.entityId(), userId);
      Row existing = rows.isEmpty() ? null : rows.get(0);
      PresenceState current = existing == null || !existing.expiresAt.isAfter(now) ? null : existing.state;
      PresenceState next = Objects.requireNonNull(update.apply(current), "update result");
      if (existing != null) {
        String sql = "UPDATE " + presenceTable
            + " SET user_name=?, action=?, updated_at=?, expires_at=?"
            + " WHERE tenant_id=? AND entity_type=? AND entity_id=? AND user_id=?";
        JdbcTemplate.update(conn, sql, next.userName(), next.action().wireName(),
            Timestamp.from(next.timestamp()), Timestamp.from(expiresAt),
            key.tenantId(), key.entityType(), key.entityId(), userId);
      } else {
        String sql = "INSERT INTO " + presenceTable
            + " (tenant_id, " + COLUMNS + ", expires_at) VALUES (?,?,?,?,?,?,?,?)";
        JdbcTemplate.update(conn, sql, key.tenantId(), userId, next.userName(), key.entityType(),
            key.entityId(), next.action().wireName(), Timestamp.from(next.timestamp()), Timestamp.from(expiresAt));
      }
      conn.commit();
      return next;
    } catch (SQLException | RuntimeException e) {
      rollback(conn, e);
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  @Override
  public Optional<PresenceState> get(PresenceKey key, String userId, Instant now) {
    String sql = "SELECT " + COLUMNS + " FROM " + presenceTable
        + " WHERE tenant_id=? AND entity_type=? AND entity_id=? AND user_id=? AND expires_at>?";
    try (Connection conn = connectionProvider.getConnection()) {
      List<PresenceState> rows = JdbcTemplate.query(conn, sql, JdbcPresenceStore::stateOf,
          key.tenantId(), key.entityType(), key.entityId(), userId, Timestamp.from(now));
      return rows.stream().findFirst();
    } catch (SQLException e) {
      throw new EventSyncStoreException("Failed to read presence for " + key, e);
    }
  }

  @Override
  public List<PresenceState> list(PresenceKey key, Instant now) {
    String sql = "SELECT " + COLUMNS + " FROM " + presenceTable
        + " WHERE tenant_id=? AND entity_type=? AND entity_id=? AND expires_at>? ORDER BY user_id";
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.query(conn, sql, JdbcPresenceStore::stateOf,
          key.tenantId(), key.entityType(), key.entityId(), Timestamp.from(now));
    } catch (SQLException e) {
      throw new EventSyncStoreException("Failed to list presence for " + key, e);
    }
  }

  @Override
  public boolean remove(PresenceKey key, String userId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return delete(conn, key, userId);
    } catch (SQLException e) {
      throw new EventSyncStoreException("Failed to remove presence for " + key, e);
    }
  }

  @Override
  public List<PresenceKey> removeAll(String tenantId, String userId) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(userId, "userId");
    String sql = "SELECT entity_type, entity_id FROM " + presenceTable + " WHERE tenant_id=? AND user_id=?";
    try (Connection conn = connectionProvider.getConnection()) {
      List<PresenceKey> keys = JdbcTemplate.query(conn, sql,
          rs -> new PresenceKey(tenantId, rs.getString("entity_type"), rs.getString("entity_id")),
          tenantId, userId);
      List<PresenceKey> removed = new ArrayList<>(keys.size());
      for (PresenceKey key : keys) {
        if (delete(conn, key, userId)) {
          removed.add(key);
        }
      }
      return removed;
    } catch (SQLException e) {
      throw new EventSyncStoreException("Failed to remove presence of userId=" + userId, e);
    }
  }

  @Override
  public int sweep(Instant now) {
    String sql = "DELETE FROM " + presenceTable + " WHERE expires_at<=?";
    try (Connection conn = connectionProvider.getConnection()) {
      int deleted = JdbcTemplate.update(conn, sql, Timestamp.from(now));
      if (deleted > 0) {
        logger.log(Level.FINE, "Swept {0} expired presence rows", deleted);
      }
      return deleted;
    } catch (SQLException e) {
      throw new EventSyncStoreException("Failed to sweep presence", e);
    }
  }

  private boolean delete(Connection conn, PresenceKey key, String userId) {
    String sql = "DELETE FROM " + presenceTable
        + " WHERE tenant_id=? AND entity_type=? AND entity_id=? AND user_id=?";
    return JdbcTemplate.update(conn, sql, key.tenantId(), key.entityType(), key.entityId(), userId) > 0;
  }

  private static PresenceState stateOf(ResultSet rs) throws SQLException {
    String action = rs.getString("action");
    return new PresenceState(
        rs.getString("user_id"),
        rs.getString("user_name"),
        rs.getString("entity_type"),
        rs.getString("entity_id"),
        PresenceAction.fromWireName(action)
            .orElseThrow(() -> new SQLException("Unknown presence action: " + action)),
        instantOf(rs, "updated_at"));
  }

  private static Instant instantOf(ResultSet rs, String column) throws SQLException {
    return rs.getTimestamp(column).toInstant();
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

  private record Row(PresenceState state, Instant expiresAt) {}
}
