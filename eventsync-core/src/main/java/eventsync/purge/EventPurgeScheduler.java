package eventsync.purge;

import eventsync.store.TieredEventStore;
import eventsync.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that removes events past their retention boundary from both tiers of a
 * {@link TieredEventStore}.
 *
 * <p>Each cycle delegates to {@link TieredEventStore#purgeExpired()}, which deletes durable rows
 * in batches until a short batch and then evicts expired cache entries.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EventPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventPurgeScheduler.class.getName());

  private final TieredEventStore store;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private EventPurgeScheduler(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("EventPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        DaemonThreadFactory.forPool("purge"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single purge cycle. May be invoked directly for one-off purges.
   *
   * @return number of durable rows and cache entries removed, {@code 0} after close
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    try {
      long removed = store.purgeExpired();
      if (removed > 0) {
        logger.log(Level.INFO, "Purged {0} expired events", removed);
      }
      return removed;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
      return 0;
    }
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /** Builder for {@link EventPurgeScheduler}. */
  public static final class Builder {
    private TieredEventStore store;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * Sets the store to purge.
     *
     * <p><b>Required.</b>
     *
     * @param store the event store
     * @return this builder
     */
    public Builder store(TieredEventStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the interval in seconds between purge cycles.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     *
     * @param intervalSeconds purge interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public EventPurgeScheduler build() {
      return new EventPurgeScheduler(this);
    }
  }
}
