package eventsync.server;

import eventsync.SyncEvent;
import eventsync.broadcast.ClientConnection;
import eventsync.broadcast.ConnectionRegistry;
import eventsync.presence.PresenceChange;
import eventsync.presence.PresenceKey;
import eventsync.presence.PresenceTracker;
import eventsync.protocol.ClientMessage;
import eventsync.protocol.ProtocolException;
import eventsync.protocol.ServerMessage;
import eventsync.protocol.WireCodec;
import eventsync.spi.ClusterRelay;
import eventsync.spi.MetricsExporter;
import eventsync.store.CatchUpResult;
import eventsync.store.TieredEventStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server side of one client connection: decodes inbound frames and answers them.
 *
 * <p>Transport adapters create a session when a channel opens, feed it every text frame via
 * {@link #onMessage(String)} and call {@link #onClose()} when the channel goes away.
 *
 * <p>Presence changes are announced to the tenant's local connections and published on the
 * {@link ClusterRelay} for connections held by other processes.
 *
 * <p>Malformed frames are dropped. After {@link #DEFAULT_MAX_MALFORMED} of them the connection is
 * closed.
 */
public final class SyncSession {
  private static final Logger logger = Logger.getLogger(SyncSession.class.getName());

  public static final int DEFAULT_MAX_MALFORMED = 5;

  private final ClientConnection connection;
  private final TieredEventStore store;
  private final ConnectionRegistry registry;
  private final PresenceTracker presence;
  private final ClusterRelay relay;
  private final MetricsExporter metrics;
  private final int pageSize;
  private final int maxMalformed;

  private final AtomicInteger malformed = new AtomicInteger();
  private final Map<PresenceKey, String> entered = new ConcurrentHashMap<>();

  public SyncSession(ClientConnection connection, TieredEventStore store, ConnectionRegistry registry,
      PresenceTracker presence, ClusterRelay relay, MetricsExporter metrics, int pageSize, int maxMalformed) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.presence = Objects.requireNonNull(presence, "presence");
    this.relay = relay != null ? relay : ClusterRelay.NOOP;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    if (maxMalformed <= 0) {
      throw new IllegalArgumentException("maxMalformed must be > 0");
    }
    this.pageSize = pageSize;
    this.maxMalformed = maxMalformed;
  }

  public ClientConnection connection() {
    return connection;
  }

  /**
   * Handles one inbound text frame.
   *
   * @param text the raw frame
   */
  public void onMessage(String text) {
    connection.touch();
    ClientMessage message;
    try {
      message = WireCodec.decodeClientMessage(text);
    } catch (ProtocolException e) {
      onMalformed(e);
      return;
    }
    if (message instanceof ClientMessage.Sync sync) {
      handleSync(sync.lastEventId());
    } else if (message instanceof ClientMessage.Subscribe subscribe) {
      connection.subscribe(subscribe.events());
    } else if (message instanceof ClientMessage.Presence update) {
      handlePresence(update);
    } else if (message instanceof ClientMessage.Pong) {
      logger.log(Level.FINEST, "Pong from {0}", connection);
    }
  }

  private void onMalformed(ProtocolException e) {
    metrics.incrementMalformedMessage();
    int count = malformed.incrementAndGet();
    logger.log(Level.FINE, "Dropped malformed frame from " + connection + ": " + e.getMessage());
    if (count >= maxMalformed) {
      logger.log(Level.WARNING, "Closing {0} after {1} malformed frames", new Object[]{connection, count});
      connection.close();
    }
  }

  private void handleSync(long since) {
    if (since > 0) {
      metrics.incrementReconnection();
    }
    CatchUpResult result = store.getEventsSince(connection.tenantId(), since, pageSize);
    List<SyncEvent> visible = new ArrayList<>(result.events().size());
    for (SyncEvent event : result.events()) {
      if (connection.accepts(event)) {
        visible.add(event);
      }
    }
    connection.send(WireCodec.encode(new ServerMessage.SyncResponse(
        visible,
        result.hasMore(),
        result.isGap(),
        result.status() == CatchUpResult.Status.UNAVAILABLE,
        result.headSequence())));
  }

  private void handlePresence(ClientMessage.Presence update) {
    String userId = connection.userId() != null ? connection.userId() : update.userId();
    if (userId == null) {
      onMalformed(new ProtocolException("presence frame without a user"));
      return;
    }
    String tenantId = connection.tenantId();
    Optional<PresenceChange> change = presence.trackPresence(tenantId, userId, update.userName(),
        update.entityType(), update.entityId(), update.action());
    PresenceKey key = new PresenceKey(tenantId, update.entityType(), update.entityId());
    if (change.isEmpty()) {
      return;
    }
    PresenceChange.Kind kind = change.get().kind();
    if (kind == PresenceChange.Kind.LEFT) {
      entered.remove(key);
    } else {
      entered.put(key, userId);
    }
    if (kind == PresenceChange.Kind.JOINED) {
      connection.send(WireCodec.encode(new ServerMessage.InitialPresence(
          update.entityType(), update.entityId(),
          presence.getPresence(tenantId, update.entityType(), update.entityId()))));
    }
    if (kind.isBroadcast()) {
      announce(tenantId, change.get());
    }
  }

  private void announce(String tenantId, PresenceChange change) {
    registry.broadcastToTenant(tenantId, new ServerMessage.PresenceNotice(change.kind(), change.state()));
    try {
      relay.publishPresence(tenantId, change);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Relay publish failed for presence change " + change, e);
    }
  }

  /**
   * Releases the connection: unregisters it, then removes and announces the presence records
   * entered through this session.
   */
  public void onClose() {
    connection.close();
    for (Map.Entry<PresenceKey, String> e : entered.entrySet()) {
      PresenceKey key = e.getKey();
      presence.removePresence(key.tenantId(), e.getValue(), key.entityType(), key.entityId())
          .ifPresent(left -> announce(key.tenantId(), left));
    }
    entered.clear();
  }
}
