package eventsync.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads of one eventsync pool.
 *
 * <p>Threads are named {@code eventsync-<pool>-1}, {@code eventsync-<pool>-2} and so on, so
 * the send, purge, keep-alive, presence and client pools are easy to tell apart in thread
 * dumps. A task that dies with an uncaught exception is logged against its pool.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
  private static final String POOL_NAME_PATTERN = "[a-z][a-z0-9]*";

  private final String pool;
  private final AtomicInteger counter = new AtomicInteger(1);

  private DaemonThreadFactory(String pool) {
    this.pool = pool;
  }

  /**
   * @param pool short lowercase pool name, for example {@code send}
   * @return a factory for that pool
   */
  public static DaemonThreadFactory forPool(String pool) {
    Objects.requireNonNull(pool, "pool");
    if (!pool.matches(POOL_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid pool name: " + pool);
    }
    return new DaemonThreadFactory(pool);
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, "eventsync-" + pool + "-" + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + pool + " pool thread " + t.getName(), e));
    return thread;
  }
}
