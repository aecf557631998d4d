package eventsync.store;

import eventsync.SyncEvent;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.EventCache;
import eventsync.spi.EventLog;
import eventsync.spi.EventPurger;
import eventsync.spi.MetricsExporter;
import eventsync.spi.SequenceService;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-tier event store: a bounded {@link EventCache} in front of a durable {@link EventLog}.
 *
 * <p>Writes go to both tiers independently. A failure in either is logged and counted but never
 * thrown, because event notification must not fail the mutation that produced it.
 *
 * <p>Catch-up reads prefer the cache and fall back to the log whenever the cache cannot prove it
 * holds every event above the cursor. Each answer is a {@link CatchUpResult} that tells the
 * caller whether more pages remain, whether the cursor fell out of retention, or whether the
 * store could not be read at all.
 *
 * <p>Sequence numbers are allocated before the event is written, so with several writing
 * processes a higher number can become visible before a lower one. A page therefore ends before
 * the first missing number, reported as PARTIAL, until the event after it is older than the
 * {@linkplain Builder#holeTimeout(Duration) hole timeout}. After that the number is taken to be
 * allocated but never stored and is skipped.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class TieredEventStore {
  private static final Logger logger = Logger.getLogger(TieredEventStore.class.getName());

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 1000;
  public static final Duration DEFAULT_HOLE_TIMEOUT = Duration.ofSeconds(5);

  private final ConnectionProvider connectionProvider;
  private final EventLog eventLog;
  private final EventCache eventCache;
  private final EventPurger purger;
  private final SequenceService sequenceService;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int purgeBatchSize;
  private final Duration holeTimeout;

  private TieredEventStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.eventLog = Objects.requireNonNull(builder.eventLog, "eventLog");
    this.sequenceService = Objects.requireNonNull(builder.sequenceService, "sequenceService");
    this.eventCache = builder.eventCache != null ? builder.eventCache : new RingBufferEventCache();
    this.purger = builder.purger;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.purgeBatchSize <= 0) {
      throw new IllegalArgumentException("purgeBatchSize must be > 0");
    }
    this.purgeBatchSize = builder.purgeBatchSize;
    this.holeTimeout = Objects.requireNonNull(builder.holeTimeout, "holeTimeout");
    if (holeTimeout.isNegative()) {
      throw new IllegalArgumentException("holeTimeout must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Appends an event to the durable log and pushes it to the cache.
   *
   * @param event the event to store
   * @return {@code true} if both tiers accepted the event
   */
  public boolean store(SyncEvent event) {
    Objects.requireNonNull(event, "event");
    boolean ok = true;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      eventLog.append(conn, event);
    } catch (SQLException | RuntimeException e) {
      ok = false;
      metrics.incrementStoreFailure();
      logger.log(Level.SEVERE, "Failed to append event to durable log: " + event, e);
    }
    try {
      eventCache.push(event);
    } catch (RuntimeException e) {
      ok = false;
      metrics.incrementStoreFailure();
      logger.log(Level.SEVERE, "Failed to push event to cache: " + event, e);
    }
    return ok;
  }

  /**
   * Pushes an event that was stored by another process into the local cache only.
   *
   * @param event the relayed event
   */
  public void cacheRelayed(SyncEvent event) {
    try {
      eventCache.push(event);
    } catch (RuntimeException e) {
      metrics.incrementStoreFailure();
      logger.log(Level.WARNING, "Failed to cache relayed event: " + event, e);
    }
  }

  /**
   * Returns the events of a tenant with {@code sequenceNumber > since}, ascending.
   *
   * <p>A cursor of {@code 0} denotes a client that has never seen an event and never yields a
   * gap. {@code limit} is clamped to {@value #MAX_LIMIT}.
   *
   * @param tenantId the tenant
   * @param since the client's last applied sequence number
   * @param limit maximum events in this page, must be &gt; 0
   * @return the catch-up answer, never {@code null}
   */
  public CatchUpResult getEventsSince(String tenantId, long since, int limit) {
    Objects.requireNonNull(tenantId, "tenantId");
    if (since < 0) {
      throw new IllegalArgumentException("since must be >= 0, got: " + since);
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    int pageSize = Math.min(limit, MAX_LIMIT);

    CatchUpResult result = fromCache(tenantId, since, pageSize);
    if (result == null) {
      result = fromLog(tenantId, since, pageSize);
    }
    if (result.status() == CatchUpResult.Status.GAP) {
      metrics.incrementCatchUpGap();
    }
    if (result.status() != CatchUpResult.Status.UNAVAILABLE) {
      metrics.incrementCatchUpServed();
    }
    return result;
  }

  private CatchUpResult fromCache(String tenantId, long since, int pageSize) {
    List<SyncEvent> window;
    try {
      window = eventCache.window(tenantId, clock.instant());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cache read failed for tenant " + tenantId + ", using durable log", e);
      return null;
    }
    if (window.isEmpty() || window.get(0).sequenceNumber() > since + 1) {
      return null;
    }
    List<SyncEvent> run = new ArrayList<>();
    long expected = since + 1;
    for (SyncEvent event : window) {
      long seq = event.sequenceNumber();
      if (seq <= since) {
        continue;
      }
      if (seq != expected) {
        // a hole in the cached run; only the log can say whether it is real
        return null;
      }
      run.add(event);
      expected++;
    }
    if (run.isEmpty()) {
      return null;
    }
    if (run.size() > pageSize) {
      return CatchUpResult.partial(run.subList(0, pageSize), since);
    }
    return CatchUpResult.complete(run, since);
  }

  private CatchUpResult fromLog(String tenantId, long since, int pageSize) {
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<SyncEvent> rows = eventLog.findSince(conn, tenantId, since, now, pageSize + 1);
      boolean firstIsNext = !rows.isEmpty() && rows.get(0).sequenceNumber() == since + 1;
      if (since > 0 && !firstIsNext && isGap(conn, tenantId, since, now)) {
        long head = Math.max(
            eventLog.newestSequence(conn, tenantId).orElse(0L),
            sequenceService.currentSequence(tenantId));
        logger.log(Level.FINE, "Catch-up gap for tenant {0}: cursor {1} predates retention, head {2}",
            new Object[]{tenantId, since, head});
        return CatchUpResult.gap(head);
      }
      return contiguousPage(tenantId, rows, since, pageSize, now);
    } catch (SQLException | RuntimeException e) {
      metrics.incrementStoreFailure();
      logger.log(Level.SEVERE, "Catch-up read failed for tenant " + tenantId + " since " + since, e);
      return CatchUpResult.unavailable(since);
    }
  }

  /**
   * Takes rows up to the page size, stopping before a missing sequence number that may still be
   * committed. A fresh cursor of {@code 0} starts at the first row.
   */
  private CatchUpResult contiguousPage(String tenantId, List<SyncEvent> rows, long since, int pageSize,
      Instant now) {
    Instant settled = now.minus(holeTimeout);
    List<SyncEvent> page = new ArrayList<>(Math.min(rows.size(), pageSize));
    long expected = since > 0 || rows.isEmpty() ? since + 1 : rows.get(0).sequenceNumber();
    for (SyncEvent event : rows) {
      if (page.size() == pageSize) {
        return CatchUpResult.partial(page, since);
      }
      if (event.sequenceNumber() != expected) {
        if (event.timestamp().isAfter(settled)) {
          logger.log(Level.FINE, "Catch-up for tenant {0} waits for sequence {1}",
              new Object[]{tenantId, expected});
          return CatchUpResult.partial(page, since);
        }
        logger.log(Level.FINE, "Skipping sequence {0} to {1} of tenant {2}: never stored",
            new Object[]{expected, event.sequenceNumber() - 1, tenantId});
      }
      page.add(event);
      expected = event.sequenceNumber() + 1;
    }
    return CatchUpResult.complete(page, since);
  }

  private boolean isGap(Connection conn, String tenantId, long since, Instant now) {
    OptionalLong oldest = eventLog.oldestSequence(conn, tenantId, now);
    if (oldest.isPresent()) {
      return oldest.getAsLong() > since + 1;
    }
    return sequenceService.currentSequence(tenantId) > since;
  }

  /**
   * Deletes durable rows past their retention boundary in batches, then evicts expired cache
   * entries. Each batch runs on its own auto-committed connection.
   *
   * @return number of durable rows and cache entries removed
   */
  public long purgeExpired() {
    Instant now = clock.instant();
    long removed = 0;
    if (purger != null) {
      int deleted;
      do {
        deleted = purgeBatch(now);
        removed += deleted;
      } while (deleted >= purgeBatchSize);
    }
    try {
      removed += eventCache.evictExpired(now);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cache eviction failed", e);
    }
    return removed;
  }

  private int purgeBatch(Instant before) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, before, purgeBatchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  /** Builder for {@link TieredEventStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private EventLog eventLog;
    private EventCache eventCache;
    private EventPurger purger;
    private SequenceService sequenceService;
    private MetricsExporter metrics;
    private Clock clock;
    private int purgeBatchSize = 500;
    private Duration holeTimeout = DEFAULT_HOLE_TIMEOUT;

    private Builder() {}

    /**
     * Sets the connection provider used for every durable read and write.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the durable log.
     *
     * <p><b>Required.</b>
     *
     * @param eventLog the durable log
     * @return this builder
     */
    public Builder eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /**
     * Sets the recent-window cache.
     *
     * <p>Optional. Defaults to a {@link RingBufferEventCache} of 1000 events per tenant.
     *
     * @param eventCache the cache
     * @return this builder
     */
    public Builder eventCache(EventCache eventCache) {
      this.eventCache = eventCache;
      return this;
    }

    /**
     * Sets the purger used by {@link #purgeExpired()}.
     *
     * <p>Optional. Without a purger only the cache is purged.
     *
     * @param purger the purger
     * @return this builder
     */
    public Builder purger(EventPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets the sequence service consulted for the tenant head when the log holds no rows.
     *
     * <p><b>Required.</b>
     *
     * @param sequenceService the sequence service
     * @return this builder
     */
    public Builder sequenceService(SequenceService sequenceService) {
      this.sequenceService = sequenceService;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for expiry decisions.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum rows deleted per purge batch.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param purgeBatchSize rows per batch
     * @return this builder
     */
    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    /**
     * Sets how long catch-up waits for a missing sequence number, measured from the creation of
     * the event after it.
     *
     * <p>Optional. Defaults to 5 seconds. {@link Duration#ZERO} never waits.
     *
     * @param holeTimeout time a sequence number may stay missing before it is skipped
     * @return this builder
     */
    public Builder holeTimeout(Duration holeTimeout) {
      this.holeTimeout = holeTimeout;
      return this;
    }

    /**
     * Builds the store.
     *
     * @return a new {@link TieredEventStore}
     * @throws NullPointerException if a required component is missing
     * @throws IllegalArgumentException if {@code purgeBatchSize <= 0}
     */
    public TieredEventStore build() {
      return new TieredEventStore(this);
    }
  }
}
