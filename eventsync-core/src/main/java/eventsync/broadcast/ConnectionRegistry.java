package eventsync.broadcast;

import com.github.f4b6a3.ulid.UlidCreator;
import eventsync.SyncEvent;
import eventsync.protocol.ServerMessage;
import eventsync.protocol.WireCodec;
import eventsync.spi.ClientChannel;
import eventsync.spi.MetricsExporter;
import eventsync.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks the client connections open in this process, grouped by tenant, and fans messages out
 * to them.
 *
 * <p>Broadcasting never blocks on a socket: frames are queued per connection and written on a
 * shared sender pool. A connection that fails or falls too far behind is closed and removed
 * without affecting the others. Messages never cross tenants.
 *
 * <p>Only local connections are known here. Other processes are reached through a
 * {@link eventsync.spi.ClusterRelay}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ConnectionRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionRegistry.class.getName());

  private final Map<String, Set<ClientConnection>> tenants = new ConcurrentHashMap<>();
  private final ExecutorService sender;
  private final boolean ownsSender;
  private final int maxQueuedFrames;
  private final MetricsExporter metrics;
  private final Clock clock;
  private volatile boolean closed;

  private ConnectionRegistry(Builder builder) {
    if (builder.maxQueuedFrames <= 0) {
      throw new IllegalArgumentException("maxQueuedFrames must be > 0");
    }
    if (builder.senderThreads <= 0) {
      throw new IllegalArgumentException("senderThreads must be > 0");
    }
    this.maxQueuedFrames = builder.maxQueuedFrames;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.sender != null) {
      this.sender = builder.sender;
      this.ownsSender = false;
    } else {
      this.sender = Executors.newFixedThreadPool(builder.senderThreads,
          DaemonThreadFactory.forPool("send"));
      this.ownsSender = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a newly opened channel.
   *
   * @param tenantId owning tenant
   * @param userId owning user, may be {@code null}
   * @param channel the transport channel
   * @return the connection handle
   * @throws IllegalStateException if the registry is closed
   */
  public ClientConnection register(String tenantId, String userId, ClientChannel channel) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    if (tenantId.isEmpty()) {
      throw new IllegalArgumentException("tenantId cannot be empty");
    }
    if (closed) {
      throw new IllegalStateException("ConnectionRegistry has been closed");
    }
    ClientConnection connection = new ClientConnection(
        UlidCreator.getMonotonicUlid().toString(), tenantId, userId, channel, sender,
        maxQueuedFrames, metrics, clock, this::remove);
    tenants.computeIfAbsent(tenantId, ignored -> ConcurrentHashMap.newKeySet()).add(connection);
    logger.log(Level.FINE, "Registered {0}", connection);
    metrics.recordConnectionCount(connectionCount());
    return connection;
  }

  /**
   * Removes the connection that wraps {@code channel}. Queued frames are discarded.
   *
   * @param tenantId owning tenant
   * @param channel the transport channel
   * @return {@code true} if a connection was removed
   */
  public boolean unregister(String tenantId, ClientChannel channel) {
    Set<ClientConnection> connections = tenants.get(tenantId);
    if (connections == null) {
      return false;
    }
    for (ClientConnection connection : connections) {
      if (connection.channel() == channel) {
        connection.close();
        return true;
      }
    }
    return false;
  }

  private void remove(ClientConnection connection) {
    tenants.computeIfPresent(connection.tenantId(), (tenantId, connections) -> {
      connections.remove(connection);
      return connections.isEmpty() ? null : connections;
    });
    logger.log(Level.FINE, "Unregistered {0}", connection);
    metrics.recordConnectionCount(connectionCount());
  }

  /**
   * Sends a message to every open connection of a tenant. Event pushes honour each connection's
   * subscription filter and user scope.
   *
   * @param tenantId the tenant
   * @param message the message
   * @return number of connections the frame was queued for
   */
  public int broadcastToTenant(String tenantId, ServerMessage message) {
    return fanOut(tenantId, null, message);
  }

  /**
   * Sends a message to the open connections of one user in a tenant.
   *
   * @param tenantId the tenant
   * @param userId the user
   * @param message the message
   * @return number of connections the frame was queued for
   */
  public int broadcastToUser(String tenantId, String userId, ServerMessage message) {
    Objects.requireNonNull(userId, "userId");
    return fanOut(tenantId, userId, message);
  }

  /**
   * Sends an event to the connections that may see it: the targeted user for user-scoped
   * events, the whole tenant otherwise.
   *
   * @param event the event
   * @return number of connections the frame was queued for
   */
  public int broadcastEvent(SyncEvent event) {
    ServerMessage push = new ServerMessage.EventPush(event);
    return event.eventType().isUserScoped()
        ? broadcastToUser(event.tenantId(), event.userId(), push)
        : broadcastToTenant(event.tenantId(), push);
  }

  private int fanOut(String tenantId, String userId, ServerMessage message) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(message, "message");
    Set<ClientConnection> connections = tenants.get(tenantId);
    if (connections == null || connections.isEmpty()) {
      return 0;
    }
    SyncEvent event = message instanceof ServerMessage.EventPush push ? push.event() : null;
    String frame = WireCodec.encode(message);
    int queued = 0;
    for (ClientConnection connection : connections) {
      if (userId != null && !userId.equals(connection.userId())) {
        continue;
      }
      if (!connection.isOpen()) {
        connection.close();
        continue;
      }
      if (event != null) {
        if (connection.accepts(event) && connection.sendEvent(frame, event)) {
          queued++;
        }
      } else if (connection.send(frame)) {
        queued++;
      }
    }
    return queued;
  }

  /**
   * Returns a snapshot of the connections of a tenant.
   *
   * @param tenantId the tenant
   * @return open and not yet removed connections
   */
  public List<ClientConnection> connections(String tenantId) {
    Set<ClientConnection> connections = tenants.get(tenantId);
    return connections == null ? List.of() : List.copyOf(connections);
  }

  /**
   * Returns a snapshot of every connection in this process.
   *
   * @return all connections
   */
  public List<ClientConnection> connections() {
    List<ClientConnection> all = new ArrayList<>();
    for (Set<ClientConnection> connections : tenants.values()) {
      all.addAll(connections);
    }
    return all;
  }

  public int connectionCount() {
    int count = 0;
    for (Set<ClientConnection> connections : tenants.values()) {
      count += connections.size();
    }
    return count;
  }

  /**
   * Closes and removes connections whose channel is no longer open, or that have sent nothing
   * for {@code idleTimeout}.
   *
   * @param idleTimeout maximum silence, or {@code null} to check only the channel state
   * @return number of connections removed
   */
  public int sweep(Duration idleTimeout) {
    Instant now = clock.instant();
    int removed = 0;
    for (ClientConnection connection : connections()) {
      boolean idle = idleTimeout != null && connection.isIdleFor(idleTimeout, now);
      if (!connection.isOpen() || idle) {
        if (idle) {
          logger.log(Level.INFO, "Closing {0}: no frame received for {1}",
              new Object[]{connection, idleTimeout});
        }
        connection.close();
        removed++;
      }
    }
    return removed;
  }

  public int sweep() {
    return sweep(null);
  }

  /** Closes every connection and shuts down the sender pool if this registry created it. */
  @Override
  public void close() {
    closed = true;
    for (ClientConnection connection : connections()) {
      connection.close();
    }
    if (ownsSender) {
      sender.shutdownNow();
      try {
        sender.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link ConnectionRegistry}. */
  public static final class Builder {
    private ExecutorService sender;
    private int senderThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
    private int maxQueuedFrames = 1024;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the executor that writes frames to channels.
     *
     * <p>Optional. Defaults to a fixed pool of daemon threads owned by the registry.
     *
     * @param sender the sender executor, not shut down by the registry
     * @return this builder
     */
    public Builder sender(ExecutorService sender) {
      this.sender = sender;
      return this;
    }

    /**
     * Sets the size of the default sender pool.
     *
     * <p>Optional. Defaults to the number of processors, at least 2.
     *
     * @param senderThreads pool size
     * @return this builder
     */
    public Builder senderThreads(int senderThreads) {
      this.senderThreads = senderThreads;
      return this;
    }

    /**
     * Sets how many frames may wait per connection before it is closed as too slow.
     *
     * <p>Optional. Defaults to {@code 1024}.
     *
     * @param maxQueuedFrames queue bound
     * @return this builder
     */
    public Builder maxQueuedFrames(int maxQueuedFrames) {
      this.maxQueuedFrames = maxQueuedFrames;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ConnectionRegistry build() {
      return new ConnectionRegistry(this);
    }
  }
}
