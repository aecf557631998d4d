package eventsync.client;

import eventsync.EventType;
import eventsync.SyncEvent;
import eventsync.presence.PresenceAction;
import eventsync.presence.PresenceChange;
import eventsync.presence.PresenceState;
import eventsync.presence.PresenceTracker;
import eventsync.protocol.ClientMessage;
import eventsync.protocol.ProtocolException;
import eventsync.protocol.ServerMessage;
import eventsync.protocol.WireCodec;
import eventsync.util.DaemonThreadFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client side of the sync protocol.
 *
 * <p>Keeps a cursor, the highest sequence number applied, and drives the connection through
 * {@link SyncState}: on every open it requests the events above the cursor, page by page, and
 * only then applies live pushes. Pushes that arrive while catching up are held back and applied
 * afterwards. Every event passes a {@link DeduplicationFilter} before it reaches the
 * {@link EventHandlerTable}, so overlap between catch-up and live delivery is harmless.
 *
 * <p>Live pushes from several server processes can arrive out of sequence order, so a push may
 * move the cursor past an event that is still being committed elsewhere. After a reconnect the
 * client therefore asks again from the cursor it held before the pushes of the last
 * {@linkplain Builder#replayWindow(Duration) replay window}; the overlap is removed by the
 * deduplication filter. A catch-up page that stops at such an uncommitted event carries no new
 * cursor and is requested again after a short delay.
 *
 * <p>Any transport failure, an idle connection, or a server that cannot read its store leads to
 * {@link SyncState#DISCONNECTED} and a reconnect after a delay from the {@link ReconnectPolicy}.
 * When the policy gives up the client stops in {@link SyncState#FAILED}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SyncClient implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncClient.class.getName());

  private final ClientTransport transport;
  private final EventHandlerTable handlers;
  private final SyncClientListener listener;
  private final ReconnectPolicy reconnectPolicy;
  private final DeduplicationFilter dedup;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Duration idleTimeout;
  private final Duration heartbeatInterval;
  private final Duration replayWindow;
  private final Duration catchUpRetryDelay;
  private final Set<EventType> subscriptions;
  private final Clock clock;

  private final Object lock = new Object();
  private final List<SyncEvent> buffered = new ArrayList<>();
  private final Deque<LiveMark> liveMarks = new ArrayDeque<>();
  private final Map<EntityKey, Presence> presence = new LinkedHashMap<>();
  private final Map<EntityKey, Map<String, PresenceState>> viewers = new HashMap<>();

  private SyncState state = SyncState.DISCONNECTED;
  private long lastSequenceNumber;
  private long catchUpCursor;
  private int generation;
  private int attempts;
  private Throwable lastError;
  private Instant lastFrameAt;
  private ScheduledFuture<?> watchdog;
  private ScheduledFuture<?> pendingReconnect;
  private boolean started;
  private boolean closed;

  private SyncClient(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.handlers = builder.handlers != null ? builder.handlers : new EventHandlerTable();
    this.listener = builder.listener != null ? builder.listener : SyncClientListener.NOOP;
    this.reconnectPolicy = builder.reconnectPolicy != null
        ? builder.reconnectPolicy
        : new ExponentialBackoffReconnectPolicy(1000L, 30_000L, 10);
    this.dedup = new DeduplicationFilter(builder.dedupCapacity);
    this.idleTimeout = Objects.requireNonNull(builder.idleTimeout, "idleTimeout");
    this.heartbeatInterval = Objects.requireNonNull(builder.heartbeatInterval, "heartbeatInterval");
    if (idleTimeout.isZero() || idleTimeout.isNegative()) {
      throw new IllegalArgumentException("idleTimeout must be positive");
    }
    if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
      throw new IllegalArgumentException("heartbeatInterval must be positive");
    }
    this.replayWindow = Objects.requireNonNull(builder.replayWindow, "replayWindow");
    this.catchUpRetryDelay = Objects.requireNonNull(builder.catchUpRetryDelay, "catchUpRetryDelay");
    if (replayWindow.isNegative()) {
      throw new IllegalArgumentException("replayWindow must be >= 0");
    }
    if (catchUpRetryDelay.isZero() || catchUpRetryDelay.isNegative()) {
      throw new IllegalArgumentException("catchUpRetryDelay must be positive");
    }
    if (builder.lastSequenceNumber < 0) {
      throw new IllegalArgumentException("lastSequenceNumber must be >= 0");
    }
    this.lastSequenceNumber = builder.lastSequenceNumber;
    this.subscriptions = builder.subscriptions != null ? Set.copyOf(builder.subscriptions) : Set.of();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(
          DaemonThreadFactory.forPool("client"));
      this.ownsScheduler = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens the first connection. Subsequent calls are no-ops.
   */
  public void start() {
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("SyncClient has been closed");
      }
      if (started) {
        return;
      }
      started = true;
      long checkMs = Math.max(1L, idleTimeout.toMillis() / 3);
      watchdog = scheduler.scheduleWithFixedDelay(this::checkIdle, checkMs, checkMs, TimeUnit.MILLISECONDS);
      connect();
    }
  }

  public SyncState state() {
    synchronized (lock) {
      return state;
    }
  }

  /**
   * Returns the highest sequence number applied. The next sync starts here, or lower while pushes
   * from the replay window are still unsettled.
   *
   * @return the cursor
   */
  public long lastSequenceNumber() {
    synchronized (lock) {
      return lastSequenceNumber;
    }
  }

  private void connect() {
    if (closed || state == SyncState.FAILED) {
      return;
    }
    pendingReconnect = null;
    int attempt = ++generation;
    transition(SyncState.CONNECTING);
    try {
      transport.connect(new AttemptListener(attempt));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport connect failed", e);
      lastError = e;
      generation++;
      disconnected();
    }
  }

  private void transition(SyncState next) {
    SyncState previous = state;
    if (previous == next) {
      return;
    }
    state = next;
    logger.log(Level.FINE, "Sync client {0} -> {1}", new Object[]{previous, next});
    try {
      listener.onStateChanged(previous, next);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Listener failed on state change", e);
    }
  }

  // ---- transport callbacks, each guarded by the attempt generation ----

  private void onOpen(int attempt) {
    synchronized (lock) {
      if (attempt != generation || closed) {
        return;
      }
      lastFrameAt = clock.instant();
      buffered.clear();
      transition(SyncState.SYNCING);
      if (!subscriptions.isEmpty()) {
        send(new ClientMessage.Subscribe(subscriptions));
      }
      catchUpCursor = replayCursor();
      send(new ClientMessage.Sync(catchUpCursor));
    }
  }

  private void onMessage(int attempt, String text) {
    synchronized (lock) {
      if (attempt != generation || closed) {
        return;
      }
      lastFrameAt = clock.instant();
      ServerMessage message;
      try {
        message = WireCodec.decodeServerMessage(text);
      } catch (ProtocolException e) {
        logger.log(Level.WARNING, "Dropped malformed server frame: " + e.getMessage());
        return;
      }
      if (message instanceof ServerMessage.EventPush push) {
        onPush(push.event());
      } else if (message instanceof ServerMessage.SyncResponse response) {
        onSyncResponse(response);
      } else if (message instanceof ServerMessage.Ping) {
        send(new ClientMessage.Pong(lastSequenceNumber));
      } else if (message instanceof ServerMessage.PresenceNotice notice) {
        onPresenceNotice(notice);
      } else if (message instanceof ServerMessage.InitialPresence initial) {
        onInitialPresence(initial);
      }
    }
  }

  private void onClosed(int attempt, String reason, Throwable error) {
    synchronized (lock) {
      if (attempt != generation || closed) {
        return;
      }
      logger.log(Level.INFO, "Connection closed: {0}", reason);
      if (error != null) {
        lastError = error;
      }
      generation++;
      disconnected();
    }
  }

  // ---- protocol ----

  private void onPush(SyncEvent event) {
    if (state == SyncState.SYNCING) {
      buffered.add(event);
    } else if (state == SyncState.LIVE) {
      apply(event);
    }
  }

  private void onSyncResponse(ServerMessage.SyncResponse response) {
    if (state != SyncState.SYNCING) {
      logger.log(Level.FINE, "Ignoring sync_response in state {0}", state);
      return;
    }
    if (response.unavailable()) {
      fail("server event store unavailable", null);
      return;
    }
    if (response.gap()) {
      logger.log(Level.WARNING, "Cursor {0} is older than the server retains, full refresh required",
          lastSequenceNumber);
      lastSequenceNumber = Math.max(lastSequenceNumber, response.lastSequenceNumber());
      liveMarks.clear();
      try {
        listener.onFullRefreshRequired(lastSequenceNumber);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Full refresh callback failed", e);
      }
      goLive();
      return;
    }
    for (SyncEvent event : response.events()) {
      apply(event);
    }
    long previous = catchUpCursor;
    catchUpCursor = Math.max(catchUpCursor, response.lastSequenceNumber());
    lastSequenceNumber = Math.max(lastSequenceNumber, catchUpCursor);
    if (!response.hasMore()) {
      if (catchUpCursor >= lastSequenceNumber) {
        liveMarks.clear();
      }
      goLive();
    } else if (catchUpCursor > previous) {
      send(new ClientMessage.Sync(catchUpCursor));
    } else {
      // the server is waiting for an event still being committed
      requestAgainLater();
    }
  }

  private void requestAgainLater() {
    int attempt = generation;
    scheduler.schedule(() -> {
      synchronized (lock) {
        if (attempt == generation && !closed && state == SyncState.SYNCING) {
          send(new ClientMessage.Sync(catchUpCursor));
        }
      }
    }, catchUpRetryDelay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private long replayCursor() {
    pruneLiveMarks();
    return liveMarks.isEmpty() ? lastSequenceNumber : liveMarks.peekFirst().previousCursor();
  }

  private void pruneLiveMarks() {
    Instant settled = clock.instant().minus(replayWindow);
    while (!liveMarks.isEmpty() && !liveMarks.peekFirst().appliedAt().isAfter(settled)) {
      liveMarks.removeFirst();
    }
  }

  private void goLive() {
    transition(SyncState.LIVE);
    attempts = 0;
    lastError = null;
    List<SyncEvent> pending = new ArrayList<>(buffered);
    buffered.clear();
    for (SyncEvent event : pending) {
      apply(event);
    }
    for (Map.Entry<EntityKey, Presence> e : presence.entrySet()) {
      send(e.getValue().message(e.getKey(), e.getValue().action));
    }
  }

  private void apply(SyncEvent event) {
    if (dedup.isDuplicate(event.id())) {
      return;
    }
    handlers.dispatch(event);
    if (event.sequenceNumber() > lastSequenceNumber) {
      if (state == SyncState.LIVE && !replayWindow.isZero()) {
        pruneLiveMarks();
        liveMarks.addLast(new LiveMark(lastSequenceNumber, clock.instant()));
      }
      lastSequenceNumber = event.sequenceNumber();
    }
  }

  private boolean send(ClientMessage message) {
    if (state != SyncState.SYNCING && state != SyncState.LIVE) {
      return false;
    }
    try {
      transport.send(WireCodec.encode(message));
      return true;
    } catch (IOException | RuntimeException e) {
      fail("send failed", e);
      return false;
    }
  }

  private void fail(String reason, Throwable error) {
    logger.log(Level.WARNING, "Dropping connection: " + reason, error);
    if (error != null) {
      lastError = error;
    }
    generation++;
    try {
      transport.close();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Error closing transport", e);
    }
    disconnected();
  }

  private void disconnected() {
    buffered.clear();
    transition(SyncState.DISCONNECTED);
    int attempt = ++attempts;
    if (reconnectPolicy.shouldGiveUp(attempt)) {
      logger.log(Level.SEVERE, "Giving up after {0} reconnect attempts", attempt - 1);
      transition(SyncState.FAILED);
      cancelTasks();
      try {
        listener.onGiveUp(attempt - 1, lastError);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Give-up callback failed", e);
      }
      return;
    }
    long delayMs = reconnectPolicy.computeDelayMs(attempt);
    logger.log(Level.FINE, "Reconnect attempt {0} in {1} ms", new Object[]{attempt, delayMs});
    pendingReconnect = scheduler.schedule(() -> {
      synchronized (lock) {
        connect();
      }
    }, delayMs, TimeUnit.MILLISECONDS);
  }

  private void checkIdle() {
    synchronized (lock) {
      if (closed || (state != SyncState.SYNCING && state != SyncState.LIVE)) {
        return;
      }
      if (!lastFrameAt.plus(idleTimeout).isAfter(clock.instant())) {
        fail("no frame received for " + idleTimeout, null);
      }
    }
  }

  // ---- presence ----

  /**
   * Announces the current user on an entity and keeps the record alive with a heartbeat until
   * {@link #leavePresence(String, String)}. Re-announced after every reconnect.
   *
   * @param entityType kind of record
   * @param entityId record identifier
   * @param action {@code VIEWING}, {@code EDITING} or {@code IDLE}
   * @param userId the current user, may be {@code null} if the server knows it
   * @param userName display name
   */
  public void enterPresence(String entityType, String entityId, PresenceAction action, String userId,
      String userName) {
    Objects.requireNonNull(action, "action");
    if (!action.isState()) {
      throw new IllegalArgumentException("action must be a presence state, got: " + action);
    }
    synchronized (lock) {
      EntityKey key = new EntityKey(entityType, entityId);
      Presence current = presence.get(key);
      if (current == null) {
        long intervalMs = heartbeatInterval.toMillis();
        current = new Presence(userId, userName);
        current.heartbeat = scheduler.scheduleWithFixedDelay(
            () -> heartbeat(entityType, entityId), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        presence.put(key, current);
      }
      current.action = action;
      send(current.message(key, action));
    }
  }

  /**
   * Refreshes the presence record on an entity without changing its action.
   */
  public void heartbeat(String entityType, String entityId) {
    synchronized (lock) {
      EntityKey key = new EntityKey(entityType, entityId);
      Presence current = presence.get(key);
      if (current != null) {
        send(current.message(key, PresenceAction.HEARTBEAT));
      }
    }
  }

  /**
   * Stops the heartbeat for an entity and announces the departure.
   */
  public void leavePresence(String entityType, String entityId) {
    synchronized (lock) {
      EntityKey key = new EntityKey(entityType, entityId);
      Presence current = presence.remove(key);
      if (current != null) {
        current.heartbeat.cancel(false);
        send(current.message(key, PresenceAction.LEFT));
      }
      viewers.remove(key);
    }
  }

  /**
   * Returns the users the server last reported on an entity, ordered by user id.
   */
  public List<PresenceState> viewers(String entityType, String entityId) {
    synchronized (lock) {
      Map<String, PresenceState> users = viewers.get(new EntityKey(entityType, entityId));
      if (users == null) {
        return List.of();
      }
      List<PresenceState> result = new ArrayList<>(users.values());
      result.sort((a, b) -> a.userId().compareTo(b.userId()));
      return result;
    }
  }

  private void onPresenceNotice(ServerMessage.PresenceNotice notice) {
    PresenceState updated = notice.presence();
    EntityKey key = new EntityKey(updated.entityType(), updated.entityId());
    Map<String, PresenceState> users = viewers.computeIfAbsent(key, ignored -> new HashMap<>());
    if (notice.kind() == PresenceChange.Kind.LEFT) {
      users.remove(updated.userId());
    } else {
      users.put(updated.userId(), updated);
    }
    firePresence(key);
  }

  private void onInitialPresence(ServerMessage.InitialPresence initial) {
    EntityKey key = new EntityKey(initial.entityType(), initial.entityId());
    Map<String, PresenceState> users = new HashMap<>();
    for (PresenceState user : initial.users()) {
      users.put(user.userId(), user);
    }
    viewers.put(key, users);
    firePresence(key);
  }

  private void firePresence(EntityKey key) {
    try {
      listener.onPresenceChanged(key.entityType(), key.entityId(), viewers(key.entityType(), key.entityId()));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Presence callback failed", e);
    }
  }

  private void cancelTasks() {
    if (watchdog != null) {
      watchdog.cancel(false);
      watchdog = null;
    }
    if (pendingReconnect != null) {
      pendingReconnect.cancel(false);
      pendingReconnect = null;
    }
    for (Presence entry : presence.values()) {
      entry.heartbeat.cancel(false);
    }
  }

  /**
   * Stops reconnecting, cancels heartbeats and closes the transport.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      for (Map.Entry<EntityKey, Presence> e : presence.entrySet()) {
        send(e.getValue().message(e.getKey(), PresenceAction.LEFT));
      }
      closed = true;
      generation++;
      cancelTasks();
      presence.clear();
      try {
        transport.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing transport", e);
      }
      if (state != SyncState.FAILED) {
        transition(SyncState.DISCONNECTED);
      }
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  private record LiveMark(long previousCursor, Instant appliedAt) {
  }

  private record EntityKey(String entityType, String entityId) {
    EntityKey {
      Objects.requireNonNull(entityType, "entityType");
      Objects.requireNonNull(entityId, "entityId");
    }
  }

  private static final class Presence {
    private final String userId;
    private final String userName;
    private PresenceAction action;
    private ScheduledFuture<?> heartbeat;

    Presence(String userId, String userName) {
      this.userId = userId;
      this.userName = userName;
    }

    ClientMessage.Presence message(EntityKey key, PresenceAction sent) {
      return new ClientMessage.Presence(key.entityType(), key.entityId(), sent, userId, userName);
    }
  }

  private final class AttemptListener implements TransportListener {
    private final int attempt;

    AttemptListener(int attempt) {
      this.attempt = attempt;
    }

    @Override
    public void onOpen() {
      SyncClient.this.onOpen(attempt);
    }

    @Override
    public void onMessage(String text) {
      SyncClient.this.onMessage(attempt, text);
    }

    @Override
    public void onClosed(String reason, Throwable error) {
      SyncClient.this.onClosed(attempt, reason, error);
    }
  }

  /** Builder for {@link SyncClient}. */
  public static final class Builder {
    private ClientTransport transport;
    private EventHandlerTable handlers;
    private SyncClientListener listener;
    private ReconnectPolicy reconnectPolicy;
    private ScheduledExecutorService scheduler;
    private Duration idleTimeout = Duration.ofSeconds(90);
    private Duration heartbeatInterval = PresenceTracker.HEARTBEAT_INTERVAL;
    private Duration replayWindow = Duration.ofSeconds(5);
    private Duration catchUpRetryDelay = Duration.ofMillis(250);
    private int dedupCapacity = DeduplicationFilter.DEFAULT_CAPACITY;
    private long lastSequenceNumber;
    private Set<EventType> subscriptions;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the transport used for every connection attempt.
     *
     * <p><b>Required.</b>
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(ClientTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the handlers applied events are dispatched to.
     *
     * <p>Optional. Defaults to an empty table.
     *
     * @param handlers the handler table
     * @return this builder
     */
    public Builder handlers(EventHandlerTable handlers) {
      this.handlers = handlers;
      return this;
    }

    public Builder listener(SyncClientListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Sets the reconnect policy.
     *
     * <p>Optional. Defaults to exponential backoff from 1 s to 30 s, giving up after 10 attempts.
     *
     * @param reconnectPolicy the policy
     * @return this builder
     */
    public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    /**
     * Sets the scheduler for reconnects, heartbeats and the idle check.
     *
     * <p>Optional. Defaults to a single daemon thread owned by the client.
     *
     * @param scheduler the scheduler, not shut down by the client
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Sets how long the connection may stay silent before it is dropped and reopened.
     *
     * <p>Optional. Defaults to 90 seconds.
     *
     * @param idleTimeout maximum silence
     * @return this builder
     */
    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
     * Sets the presence heartbeat interval.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param heartbeatInterval time between heartbeats
     * @return this builder
     */
    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    /**
     * Sets how long a cursor advanced by a live push stays unsettled. A reconnect within that
     * time syncs from the cursor held before the push. Should match the server's hole timeout.
     *
     * <p>Optional. Defaults to 5 seconds. {@link Duration#ZERO} always resumes from the highest
     * applied sequence number.
     *
     * @param replayWindow time before a pushed sequence number is trusted as a cursor
     * @return this builder
     */
    public Builder replayWindow(Duration replayWindow) {
      this.replayWindow = replayWindow;
      return this;
    }

    /**
     * Sets the delay before asking again for a catch-up page that made no progress.
     *
     * <p>Optional. Defaults to 250 milliseconds.
     *
     * @param catchUpRetryDelay delay before the repeated request
     * @return this builder
     */
    public Builder catchUpRetryDelay(Duration catchUpRetryDelay) {
      this.catchUpRetryDelay = catchUpRetryDelay;
      return this;
    }

    /**
     * Sets how many event ids the deduplication filter remembers.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param dedupCapacity remembered ids
     * @return this builder
     */
    public Builder dedupCapacity(int dedupCapacity) {
      this.dedupCapacity = dedupCapacity;
      return this;
    }

    /**
     * Sets the initial cursor, for clients that persist it across restarts.
     *
     * <p>Optional. Defaults to {@code 0}.
     *
     * @param lastSequenceNumber highest sequence number already applied
     * @return this builder
     */
    public Builder lastSequenceNumber(long lastSequenceNumber) {
      this.lastSequenceNumber = lastSequenceNumber;
      return this;
    }

    /**
     * Restricts delivery to the given event types.
     *
     * <p>Optional. Defaults to all types.
     *
     * @param subscriptions subscribed types
     * @return this builder
     */
    public Builder subscriptions(Set<EventType> subscriptions) {
      this.subscriptions = subscriptions;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public SyncClient build() {
      return new SyncClient(this);
    }
  }
}
