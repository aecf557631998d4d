package eventsync.server;

import eventsync.broadcast.ClientConnection;
import eventsync.broadcast.ConnectionRegistry;
import eventsync.protocol.ServerMessage;
import eventsync.protocol.WireCodec;
import eventsync.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pings every local connection at a fixed interval and closes the ones that have sent nothing
 * for longer than the idle timeout.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class KeepAliveScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(KeepAliveScheduler.class.getName());

  private static final String PING_FRAME = WireCodec.encode(new ServerMessage.Ping());

  private final ConnectionRegistry registry;
  private final Duration pingInterval;
  private final Duration idleTimeout;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pingTask;
  private volatile boolean closed;

  private KeepAliveScheduler(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.pingInterval = Objects.requireNonNull(builder.pingInterval, "pingInterval");
    this.idleTimeout = Objects.requireNonNull(builder.idleTimeout, "idleTimeout");
    if (pingInterval.isZero() || pingInterval.isNegative()) {
      throw new IllegalArgumentException("pingInterval must be positive");
    }
    if (idleTimeout.compareTo(pingInterval) <= 0) {
      throw new IllegalArgumentException("idleTimeout must be longer than pingInterval");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the ping loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("KeepAliveScheduler has been closed");
    }
    if (pingTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        DaemonThreadFactory.forPool("keepalive"));
    long millis = pingInterval.toMillis();
    pingTask = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Closes idle connections, then pings the rest.
   *
   * @return number of connections pinged
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int closedIdle = registry.sweep(idleTimeout);
      if (closedIdle > 0) {
        logger.log(Level.FINE, "Closed {0} idle connections", closedIdle);
      }
      int pinged = 0;
      for (ClientConnection connection : registry.connections()) {
        if (connection.send(PING_FRAME)) {
          pinged++;
        }
      }
      return pinged;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Keep-alive cycle failed", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (pingTask != null) {
      pingTask.cancel(false);
      pingTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link KeepAliveScheduler}. */
  public static final class Builder {
    private ConnectionRegistry registry;
    private Duration pingInterval = Duration.ofSeconds(30);
    private Duration idleTimeout = Duration.ofSeconds(90);

    private Builder() {}

    /**
     * Sets the registry whose connections are kept alive.
     *
     * <p><b>Required.</b>
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(ConnectionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the ping interval.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param pingInterval time between pings
     * @return this builder
     */
    public Builder pingInterval(Duration pingInterval) {
      this.pingInterval = pingInterval;
      return this;
    }

    /**
     * Sets how long a connection may stay silent before it is closed.
     *
     * <p>Optional. Defaults to 90 seconds. Must exceed the ping interval.
     *
     * @param idleTimeout maximum silence
     * @return this builder
     */
    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    public KeepAliveScheduler build() {
      return new KeepAliveScheduler(this);
    }
  }
}
