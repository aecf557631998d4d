package eventsync.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for event synchronization.
 *
 * @see EventSyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventsync")
public class EventSyncProperties {

  /**
   * Deployment mode: one server process, or several sharing one database.
   */
  private Mode mode = Mode.SINGLE_NODE;

  /**
   * Database table name for the event log.
   */
  private String tableName = "sync_event_log";

  /**
   * Database table name for the shared sequence counters.
   */
  private String sequenceTableName = "sync_sequence";

  /**
   * Allocate sequence numbers from the database counter table even in single-node mode.
   */
  private boolean sharedSequence = false;

  /**
   * How long events stay available for catch-up.
   */
  private Duration retention = Duration.ofHours(24);

  private final CatchUp catchUp = new CatchUp();
  private final Connection connection = new Connection();
  private final KeepAlive keepAlive = new KeepAlive();
  private final Presence presence = new Presence();
  private final Purge purge = new Purge();
  private final Metrics metrics = new Metrics();
  private final WebSocket websocket = new WebSocket();

  public Mode getMode() {
    return mode;
  }

  public void setMode(Mode mode) {
    this.mode = mode;
  }

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public String getSequenceTableName() {
    return sequenceTableName;
  }

  public void setSequenceTableName(String sequenceTableName) {
    this.sequenceTableName = sequenceTableName;
  }

  public boolean isSharedSequence() {
    return sharedSequence;
  }

  public void setSharedSequence(boolean sharedSequence) {
    this.sharedSequence = sharedSequence;
  }

  public Duration getRetention() {
    return retention;
  }

  public void setRetention(Duration retention) {
    this.retention = retention;
  }

  public CatchUp getCatchUp() {
    return catchUp;
  }

  public Connection getConnection() {
    return connection;
  }

  public KeepAlive getKeepAlive() {
    return keepAlive;
  }

  public Presence getPresence() {
    return presence;
  }

  public Purge getPurge() {
    return purge;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public WebSocket getWebsocket() {
    return websocket;
  }

  public enum Mode {
    SINGLE_NODE,
    MULTI_NODE
  }

  public static class CatchUp {
    private int pageSize = 100;

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }
  }

  public static class Connection {
    private int maxQueuedFrames = 1024;
    private int maxMalformedMessages = 5;

    public int getMaxQueuedFrames() {
      return maxQueuedFrames;
    }

    public void setMaxQueuedFrames(int maxQueuedFrames) {
      this.maxQueuedFrames = maxQueuedFrames;
    }

    public int getMaxMalformedMessages() {
      return maxMalformedMessages;
    }

    public void setMaxMalformedMessages(int maxMalformedMessages) {
      this.maxMalformedMessages = maxMalformedMessages;
    }
  }

  public static class KeepAlive {
    private Duration pingInterval = Duration.ofSeconds(30);
    private Duration idleTimeout = Duration.ofSeconds(90);

    public Duration getPingInterval() {
      return pingInterval;
    }

    public void setPingInterval(Duration pingInterval) {
      this.pingInterval = pingInterval;
    }

    public Duration getIdleTimeout() {
      return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
    }
  }

  public static class Presence {
    private Duration ttl = Duration.ofMinutes(5);

    /**
     * Database table shared by all nodes for presence records in multi-node mode.
     */
    private String tableName = "sync_presence";

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public String getTableName() {
      return tableName;
    }

    public void setTableName(String tableName) {
      this.tableName = tableName;
    }
  }

  public static class Purge {
    private boolean enabled = true;
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "eventsync";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class WebSocket {
    private boolean enabled = true;
    private String path = "/ws/sync";
    private List<String> allowedOriginPatterns = new ArrayList<>();
    private int sendTimeLimitMs = 10_000;
    private int bufferSizeLimit = 512 * 1024;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public List<String> getAllowedOriginPatterns() {
      return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
      this.allowedOriginPatterns = allowedOriginPatterns;
    }

    public int getSendTimeLimitMs() {
      return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
      this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getBufferSizeLimit() {
      return bufferSizeLimit;
    }

    public void setBufferSizeLimit(int bufferSizeLimit) {
      this.bufferSizeLimit = bufferSizeLimit;
    }
  }
}
