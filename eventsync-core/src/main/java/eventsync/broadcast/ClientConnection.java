package eventsync.broadcast;

import eventsync.EventType;
import eventsync.SyncEvent;
import eventsync.spi.ClientChannel;
import eventsync.spi.MetricsExporter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One open client channel owned by a tenant and optionally a user.
 *
 * <p>Outgoing frames go through a bounded queue drained by at most one sender task at a time,
 * so frames reach the channel in enqueue order and a slow channel only ever occupies one sender
 * thread. When the queue overflows the connection is closed; the client catches up after it
 * reconnects.
 *
 * <p>Instances are created by {@link ConnectionRegistry#register(String, String, ClientChannel)}.
 */
public final class ClientConnection {
  private static final Logger logger = Logger.getLogger(ClientConnection.class.getName());

  private final String id;
  private final String tenantId;
  private final String userId;
  private final ClientChannel channel;
  private final Executor sender;
  private final int maxQueued;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Consumer<ClientConnection> onClose;

  private final Queue<Frame> queue = new ConcurrentLinkedQueue<>();
  private final AtomicInteger queued = new AtomicInteger();
  private final AtomicBoolean draining = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile Set<EventType> subscriptions = Set.of();
  private volatile Instant lastSeen;

  ClientConnection(String id, String tenantId, String userId, ClientChannel channel, Executor sender,
      int maxQueued, MetricsExporter metrics, Clock clock, Consumer<ClientConnection> onClose) {
    this.id = id;
    this.tenantId = tenantId;
    this.userId = userId;
    this.channel = channel;
    this.sender = sender;
    this.maxQueued = maxQueued;
    this.metrics = metrics;
    this.clock = clock;
    this.onClose = onClose;
    this.lastSeen = clock.instant();
  }

  public String id() {
    return id;
  }

  public String tenantId() {
    return tenantId;
  }

  /**
   * @return the owning user, or {@code null} for anonymous connections
   */
  public String userId() {
    return userId;
  }

  public ClientChannel channel() {
    return channel;
  }

  public Set<EventType> subscriptions() {
    return subscriptions;
  }

  /**
   * Replaces the subscription filter. An empty set receives every event type.
   *
   * @param eventTypes subscribed types
   */
  public void subscribe(Set<EventType> eventTypes) {
    this.subscriptions = Set.copyOf(Objects.requireNonNull(eventTypes, "eventTypes"));
  }

  /**
   * Returns {@code true} if this connection should receive the event: it belongs to the same
   * tenant, matches the subscription filter, and is not addressed to another user.
   *
   * @param event the event
   * @return whether to deliver
   */
  public boolean accepts(SyncEvent event) {
    if (!tenantId.equals(event.tenantId()) || !event.isVisibleTo(userId)) {
      return false;
    }
    Set<EventType> filter = subscriptions;
    return filter.isEmpty() || filter.contains(event.eventType());
  }

  /** Marks the client as alive, on any inbound frame. */
  public void touch() {
    lastSeen = clock.instant();
  }

  public Instant lastSeen() {
    return lastSeen;
  }

  boolean isIdleFor(Duration timeout, Instant now) {
    return !lastSeen.plus(timeout).isAfter(now);
  }

  public boolean isOpen() {
    return !closed.get() && channel.isOpen();
  }

  public int queuedFrames() {
    return queued.get();
  }

  /**
   * Queues a frame for sending.
   *
   * @param text the encoded frame
   * @return {@code false} if the connection is closed or was closed because its queue is full
   */
  public boolean send(String text) {
    return enqueue(new Frame(text, null));
  }

  boolean sendEvent(String text, SyncEvent event) {
    return enqueue(new Frame(text, event.timestamp()));
  }

  private boolean enqueue(Frame frame) {
    if (closed.get()) {
      return false;
    }
    if (queued.incrementAndGet() > maxQueued) {
      queued.decrementAndGet();
      metrics.incrementSendFailure();
      logger.log(Level.WARNING, "Send queue of connection {0} (tenant {1}) is full, closing",
          new Object[]{id, tenantId});
      close();
      return false;
    }
    queue.add(frame);
    scheduleDrain();
    return true;
  }

  private void scheduleDrain() {
    if (draining.compareAndSet(false, true)) {
      try {
        sender.execute(this::drain);
      } catch (RejectedExecutionException e) {
        draining.set(false);
        logger.log(Level.WARNING, "Sender pool rejected drain for connection " + id, e);
        close();
      }
    }
  }

  private void drain() {
    try {
      Frame frame;
      while ((frame = queue.poll()) != null) {
        queued.decrementAndGet();
        if (!write(frame)) {
          return;
        }
      }
    } finally {
      draining.set(false);
    }
    // a frame may have been queued after the last poll but before the flag was cleared
    if (!queue.isEmpty() && !closed.get()) {
      scheduleDrain();
    }
  }

  private boolean write(Frame frame) {
    if (closed.get()) {
      return false;
    }
    if (!channel.isOpen()) {
      close();
      return false;
    }
    try {
      channel.send(frame.text);
      metrics.incrementMessagesSent();
      if (frame.eventTimestamp != null) {
        long latencyMs = Duration.between(frame.eventTimestamp, clock.instant()).toMillis();
        metrics.recordDeliveryLatencyMs(Math.max(0L, latencyMs));
      }
      return true;
    } catch (IOException | RuntimeException e) {
      metrics.incrementSendFailure();
      logger.log(Level.WARNING, "Send to connection " + id + " (tenant " + tenantId + ") failed, closing", e);
      close();
      return false;
    }
  }

  /**
   * Closes the channel, discards queued frames and removes the connection from its registry.
   * Idempotent.
   */
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    queue.clear();
    queued.set(0);
    try {
      channel.close();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Error closing channel of connection " + id, e);
    }
    onClose.accept(this);
  }

  @Override
  public String toString() {
    return "ClientConnection{id=" + id + ", tenantId=" + tenantId
        + (userId != null ? ", userId=" + userId : "") + '}';
  }

  private static final class Frame {
    private final String text;
    private final Instant eventTimestamp;

    Frame(String text, Instant eventTimestamp) {
      this.text = text;
      this.eventTimestamp = eventTimestamp;
    }
  }
}
