package eventsync;

import eventsync.broadcast.ConnectionRegistry;
import eventsync.presence.InMemoryPresenceStore;
import eventsync.presence.PresenceTracker;
import eventsync.protocol.ServerMessage;
import eventsync.purge.EventPurgeScheduler;
import eventsync.sequence.InMemorySequenceService;
import eventsync.server.KeepAliveScheduler;
import eventsync.server.SyncSession;
import eventsync.spi.ClientChannel;
import eventsync.spi.ClusterRelay;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.EventCache;
import eventsync.spi.EventLog;
import eventsync.spi.EventPurger;
import eventsync.spi.MetricsExporter;
import eventsync.spi.PresenceStore;
import eventsync.spi.SequenceService;
import eventsync.spi.TxContext;
import eventsync.store.RingBufferEventCache;
import eventsync.store.TieredEventStore;
import eventsync.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the event store, connection registry, presence tracker,
 * emitter and background schedulers into a single {@link AutoCloseable} unit.
 *
 * <p>Two scenario-specific builders cover the deployment topologies:
 * <ul>
 *   <li>{@link #singleNode()}: one server process; sequence numbers come from an in-process
 *       counter seeded from the durable log.</li>
 *   <li>{@link #multiNode()}: several processes behind a load balancer; a shared
 *       {@link SequenceService}, a shared {@link PresenceStore} and a {@link ClusterRelay} are
 *       required.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventSync sync = EventSync.singleNode()
 *     .connectionProvider(dataSource::getConnection)
 *     .eventLog(new H2EventLog())
 *     .purger(new H2EventPurger())
 *     .build()) {
 *   sync.start();
 *   // transport adapter: SyncSession session = sync.openSession(tenantId, userId, channel);
 *   sync.emitter().emitLeadCreated(tenantId, lead);
 * }
 * }</pre>
 */
public final class EventSync implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventSync.class.getName());

  private final TieredEventStore store;
  private final ConnectionRegistry registry;
  private final PresenceTracker presence;
  private final EventEmitter emitter;
  private final EventPurgeScheduler purgeScheduler;
  private final KeepAliveScheduler keepAlive;
  private final ClusterRelay relay;
  private final MetricsExporter metrics;
  private final int pageSize;
  private final int maxMalformedMessages;
  private final long presenceSweepMs;

  private ScheduledExecutorService presenceSweeper;
  private boolean started;

  private EventSync(AbstractBuilder<?> b, SequenceService sequenceService, ClusterRelay relay) {
    this.metrics = b.metrics != null ? b.metrics : MetricsExporter.NOOP;
    this.relay = relay;
    Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
    this.pageSize = b.pageSize;
    this.maxMalformedMessages = b.maxMalformedMessages;
    this.presenceSweepMs = b.presenceTtl.toMillis();

    this.store = TieredEventStore.builder()
        .connectionProvider(b.connectionProvider)
        .eventLog(b.eventLog)
        .eventCache(b.eventCache != null ? b.eventCache
            : new RingBufferEventCache(RingBufferEventCache.DEFAULT_CAPACITY, b.retention, clock))
        .purger(b.purger)
        .sequenceService(sequenceService)
        .metrics(metrics)
        .clock(clock)
        .purgeBatchSize(b.purgeBatchSize)
        .build();
    this.registry = ConnectionRegistry.builder()
        .maxQueuedFrames(b.maxQueuedFrames)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.presence = new PresenceTracker(
        b.presenceStore != null ? b.presenceStore : new InMemoryPresenceStore(), b.presenceTtl, clock);
    this.emitter = new EventEmitter(sequenceService, store, registry, relay, metrics, b.txContext,
        clock, b.retention);
    this.purgeScheduler = EventPurgeScheduler.builder()
        .store(store)
        .intervalSeconds(b.purgeIntervalSeconds)
        .build();
    this.keepAlive = KeepAliveScheduler.builder()
        .registry(registry)
        .pingInterval(b.pingInterval)
        .idleTimeout(b.idleTimeout)
        .build();

    relay.subscribe(event -> {
      store.cacheRelayed(event);
      registry.broadcastEvent(event);
    });
    relay.subscribePresence((tenantId, change) -> registry.broadcastToTenant(
        tenantId, new ServerMessage.PresenceNotice(change.kind(), change.state())));
  }

  /**
   * Creates a builder for a single server process.
   *
   * @return a new single-node builder
   */
  public static SingleNodeBuilder singleNode() {
    return new SingleNodeBuilder();
  }

  /**
   * Creates a builder for several server processes sharing one database.
   *
   * @return a new multi-node builder
   */
  public static MultiNodeBuilder multiNode() {
    return new MultiNodeBuilder();
  }

  /**
   * Starts the purge, keep-alive and presence sweep schedules. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (started) {
      return;
    }
    started = true;
    purgeScheduler.start();
    keepAlive.start();
    presenceSweeper = Executors.newSingleThreadScheduledExecutor(
        DaemonThreadFactory.forPool("presence"));
    presenceSweeper.scheduleWithFixedDelay(
        presence::sweep, presenceSweepMs, presenceSweepMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Registers a newly opened client channel and returns the session that serves it.
   *
   * @param tenantId owning tenant, already authenticated by the caller
   * @param userId owning user, may be {@code null}
   * @param channel the transport channel
   * @return the session; feed it inbound frames and call {@link SyncSession#onClose()} on close
   */
  public SyncSession openSession(String tenantId, String userId, ClientChannel channel) {
    return new SyncSession(registry.register(tenantId, userId, channel), store, registry, presence,
        relay, metrics, pageSize, maxMalformedMessages);
  }

  public EventEmitter emitter() {
    return emitter;
  }

  public TieredEventStore store() {
    return store;
  }

  public ConnectionRegistry registry() {
    return registry;
  }

  public PresenceTracker presence() {
    return presence;
  }

  public EventPurgeScheduler purgeScheduler() {
    return purgeScheduler;
  }

  public KeepAliveScheduler keepAlive() {
    return keepAlive;
  }

  /**
   * Shuts down components in order: schedulers, then the registry with its connections.
   */
  @Override
  public synchronized void close() {
    RuntimeException first = null;
    try {
      purgeScheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      keepAlive.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (presenceSweeper != null) {
      presenceSweeper.shutdownNow();
    }
    try {
      registry.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
    logger.log(Level.FINE, "EventSync closed");
  }

  // ── Abstract builder ─────────────────────────────────────────────

  /**
   * Base builder with shared required and optional parameters.
   *
   * @param <B> the concrete builder type
   */
  public static abstract sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits SingleNodeBuilder, MultiNodeBuilder {

    ConnectionProvider connectionProvider;
    EventLog eventLog;
    EventPurger purger;
    EventCache eventCache;
    PresenceStore presenceStore;
    MetricsExporter metrics;
    TxContext txContext;
    Clock clock;
    Duration retention = SyncEvent.DEFAULT_RETENTION;
    Duration presenceTtl = PresenceTracker.DEFAULT_TTL;
    Duration pingInterval = Duration.ofSeconds(30);
    Duration idleTimeout = Duration.ofSeconds(90);
    int pageSize = TieredEventStore.DEFAULT_LIMIT;
    int maxMalformedMessages = SyncSession.DEFAULT_MAX_MALFORMED;
    int maxQueuedFrames = 1024;
    int purgeBatchSize = 500;
    long purgeIntervalSeconds = 3600;
    private final AtomicBoolean built = new AtomicBoolean(false);

    AbstractBuilder() {}

    void markBuilt() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
    }

    void validate() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(eventLog, "eventLog");
      Objects.requireNonNull(retention, "retention");
      Objects.requireNonNull(presenceTtl, "presenceTtl");
      if (retention.isZero() || retention.isNegative()) {
        throw new IllegalArgumentException("retention must be positive");
      }
      if (pageSize <= 0 || pageSize > TieredEventStore.MAX_LIMIT) {
        throw new IllegalArgumentException("pageSize must be in [1, " + TieredEventStore.MAX_LIMIT + "]");
      }
    }

    @SuppressWarnings("unchecked")
    private B self() {
      return (B) this;
    }

    /**
     * Sets the connection provider for the durable log.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public B connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return self();
    }

    /**
     * Sets the durable event log.
     *
     * <p><b>Required.</b>
     *
     * @param eventLog the log, typically a database-specific JDBC implementation
     * @return this builder
     */
    public B eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return self();
    }

    /**
     * Sets the purger for expired log rows.
     *
     * <p>Optional. Without a purger only the cache is purged.
     *
     * @param purger the purger
     * @return this builder
     */
    public B purger(EventPurger purger) {
      this.purger = purger;
      return self();
    }

    /**
     * Sets the recent-event cache.
     *
     * <p>Optional. Defaults to a {@link RingBufferEventCache} of 1000 events per tenant.
     *
     * @param eventCache the cache
     * @return this builder
     */
    public B eventCache(EventCache eventCache) {
      this.eventCache = eventCache;
      return self();
    }

    /**
     * Sets the presence store.
     *
     * <p>Optional for a single node, where it defaults to {@link InMemoryPresenceStore}.
     * <b>Required</b> for several nodes, which must all see the same records.
     *
     * @param presenceStore the store
     * @return this builder
     */
    public B presenceStore(PresenceStore presenceStore) {
      this.presenceStore = presenceStore;
      return self();
    }

    /**
     * Sets the metrics exporter. Closed with this instance if it is {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }

    /**
     * Sets the transaction bridge used by {@link EventEmitter#emitAfterCommit}.
     *
     * <p>Optional. Without it, deferred emissions run immediately.
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public B txContext(TxContext txContext) {
      this.txContext = txContext;
      return self();
    }

    public B clock(Clock clock) {
      this.clock = clock;
      return self();
    }

    /**
     * Sets how long events are retained.
     *
     * <p>Optional. Defaults to 24 hours.
     *
     * @param retention the retention window
     * @return this builder
     */
    public B retention(Duration retention) {
      this.retention = retention;
      return self();
    }

    /**
     * Sets the presence record TTL.
     *
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param presenceTtl time a record lives after its last heartbeat
     * @return this builder
     */
    public B presenceTtl(Duration presenceTtl) {
      this.presenceTtl = presenceTtl;
      return self();
    }

    public B pingInterval(Duration pingInterval) {
      this.pingInterval = pingInterval;
      return self();
    }

    public B idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return self();
    }

    /**
     * Sets the maximum number of events per catch-up page.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @param pageSize events per page
     * @return this builder
     */
    public B pageSize(int pageSize) {
      this.pageSize = pageSize;
      return self();
    }

    public B maxMalformedMessages(int maxMalformedMessages) {
      this.maxMalformedMessages = maxMalformedMessages;
      return self();
    }

    public B maxQueuedFrames(int maxQueuedFrames) {
      this.maxQueuedFrames = maxQueuedFrames;
      return self();
    }

    public B purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return self();
    }

    public B purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return self();
    }
  }

  /**
   * Builder for a single server process. Sequence numbers are allocated in memory and seeded
   * from the durable log on first use per tenant.
   */
  public static final class SingleNodeBuilder extends AbstractBuilder<SingleNodeBuilder> {
    private SequenceService sequenceService;

    SingleNodeBuilder() {}

    /**
     * Overrides the sequence service.
     *
     * <p>Optional. Defaults to {@link InMemorySequenceService#seededFrom}.
     *
     * @param sequenceService the sequence service
     * @return this builder
     */
    public SingleNodeBuilder sequenceService(SequenceService sequenceService) {
      this.sequenceService = sequenceService;
      return this;
    }

    public EventSync build() {
      markBuilt();
      validate();
      SequenceService sequences = sequenceService != null
          ? sequenceService
          : InMemorySequenceService.seededFrom(connectionProvider, eventLog);
      return new EventSync(this, sequences, ClusterRelay.NOOP);
    }
  }

  /**
   * Builder for several server processes. A shared, atomically incremented
   * {@link SequenceService} is required so that processes never issue the same number, a shared
   * {@link PresenceStore} so that every process sees every viewer, and a {@link ClusterRelay}
   * that carries events and presence changes to clients connected elsewhere.
   */
  public static final class MultiNodeBuilder extends AbstractBuilder<MultiNodeBuilder> {
    private SequenceService sequenceService;
    private ClusterRelay clusterRelay;

    MultiNodeBuilder() {}

    /**
     * Sets the shared sequence service.
     *
     * <p><b>Required.</b>
     *
     * @param sequenceService the sequence service
     * @return this builder
     */
    public MultiNodeBuilder sequenceService(SequenceService sequenceService) {
      this.sequenceService = sequenceService;
      return this;
    }

    /**
     * Sets the relay to the other processes.
     *
     * <p><b>Required.</b>
     *
     * @param clusterRelay the relay
     * @return this builder
     */
    public MultiNodeBuilder clusterRelay(ClusterRelay clusterRelay) {
      this.clusterRelay = clusterRelay;
      return this;
    }

    public EventSync build() {
      markBuilt();
      validate();
      Objects.requireNonNull(sequenceService, "sequenceService");
      Objects.requireNonNull(clusterRelay, "clusterRelay");
      Objects.requireNonNull(presenceStore, "presenceStore");
      return new EventSync(this, sequenceService, clusterRelay);
    }
  }
}
