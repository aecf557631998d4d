package eventsync.jdbc.log;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event logs with auto-detection support.
 *
 * <p>Event logs are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventsync.jdbc.log.AbstractJdbcEventLog}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventLog log = JdbcEventLogs.detect(dataSource);
 *
 * // Get by name
 * AbstractJdbcEventLog log = JdbcEventLogs.get("postgresql");
 * }</pre>
 */
public final class JdbcEventLogs {

  private static final List<AbstractJdbcEventLog> LOGS;
  private static final Map<String, AbstractJdbcEventLog> BY_NAME = new ConcurrentHashMap<>();

  static {
    LOGS = ServiceLoader.load(AbstractJdbcEventLog.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEventLog log : LOGS) {
      BY_NAME.put(log.name().toLowerCase(Locale.ROOT), log);
    }
  }

  private JdbcEventLogs() {
  }

  /**
   * Returns all registered event logs.
   */
  public static List<AbstractJdbcEventLog> all() {
    return LOGS;
  }

  /**
   * Gets an event log by name.
   *
   * @param name event log name (case-insensitive)
   * @return the event log
   * @throws IllegalArgumentException if no event log found
   */
  public static AbstractJdbcEventLog get(String name) {
    AbstractJdbcEventLog log = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (log == null) {
      throw new IllegalArgumentException("Unknown event log: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return log;
  }

  /**
   * Auto-detects the event log from a DataSource.
   *
   * @param dataSource the data source
   * @return detected event log
   * @throws IllegalStateException if the connection metadata cannot be read
   */
  public static AbstractJdbcEventLog detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event log from DataSource", e);
    }
  }

  /**
   * Auto-detects the event log from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected event log
   * @throws IllegalArgumentException if no matching event log found
   */
  public static AbstractJdbcEventLog detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcEventLog log : LOGS) {
      for (String prefix : log.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return log;
        }
      }
    }
    throw new IllegalArgumentException("No event log found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return LOGS.stream()
        .flatMap(l -> l.jdbcUrlPrefixes().stream())
        .toList();
  }
}
