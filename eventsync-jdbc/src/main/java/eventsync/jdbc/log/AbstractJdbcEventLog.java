package eventsync.jdbc.log;

import eventsync.EventType;
import eventsync.SyncEvent;
import eventsync.jdbc.JdbcTemplate;
import eventsync.jdbc.TableNames;
import eventsync.spi.EventLog;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Base JDBC event log with standard SQL that runs unchanged on H2, MySQL and PostgreSQL.
 *
 * <p>Rows are keyed by {@code (tenant_id, sequence_number)}; that primary key is what makes
 * {@link #findSince} an index range scan. Register custom implementations via
 * {@code META-INF/services/eventsync.jdbc.log.AbstractJdbcEventLog}.
 *
 * @see JdbcEventLogs
 */
public abstract class AbstractJdbcEventLog implements EventLog {

  protected static final JdbcTemplate.RowMapper<SyncEvent> EVENT_ROW_MAPPER = rs ->
      SyncEvent.builder(EventType.ofWireName(rs.getString("event_type")))
          .id(rs.getString("event_id"))
          .tenantId(rs.getString("tenant_id"))
          .sequenceNumber(rs.getLong("sequence_number"))
          .payloadJson(rs.getString("payload"))
          .userId(rs.getString("user_id"))
          .timestamp(rs.getTimestamp("created_at").toInstant())
          .expiresAt(rs.getTimestamp("expires_at").toInstant())
          .build();

  private final String tableName;

  protected AbstractJdbcEventLog() {
    this(TableNames.DEFAULT_EVENT_TABLE);
  }

  protected AbstractJdbcEventLog(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this event log (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this event log handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this event log writing to another table.
   *
   * @param tableName the table name
   * @return a new event log of the same dialect
   */
  public abstract AbstractJdbcEventLog withTableName(String tableName);

  /**
   * Classpath location of the DDL for this dialect, for use with a schema initializer.
   */
  public String schemaResource() {
    return "eventsync/schema/" + name() + ".sql";
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public void append(Connection conn, SyncEvent event) {
    Objects.requireNonNull(event, "event");
    String sql = "INSERT INTO " + tableName() + " (" +
        "tenant_id, sequence_number, event_id, event_type, payload, user_id, created_at, expires_at" +
        ") VALUES (?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        event.tenantId(), event.sequenceNumber(), event.id(), event.eventType().wireName(),
        event.payloadJson(), event.userId(),
        Timestamp.from(event.timestamp()), Timestamp.from(event.expiresAt()));
  }

  @Override
  public List<SyncEvent> findSince(Connection conn, String tenantId, long since, Instant now, int limit) {
    String sql = "SELECT tenant_id, sequence_number, event_id, event_type, payload, user_id, " +
        "created_at, expires_at FROM " + tableName() +
        " WHERE tenant_id=? AND sequence_number>? AND expires_at>? ORDER BY sequence_number LIMIT ?";
    return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, tenantId, since, Timestamp.from(now), limit);
  }

  @Override
  public OptionalLong oldestSequence(Connection conn, String tenantId, Instant now) {
    String sql = "SELECT MIN(sequence_number) FROM " + tableName() + " WHERE tenant_id=? AND expires_at>?";
    return JdbcTemplate.queryForLong(conn, sql, tenantId, Timestamp.from(now));
  }

  @Override
  public OptionalLong newestSequence(Connection conn, String tenantId) {
    String sql = "SELECT MAX(sequence_number) FROM " + tableName() + " WHERE tenant_id=?";
    return JdbcTemplate.queryForLong(conn, sql, tenantId);
  }
}
