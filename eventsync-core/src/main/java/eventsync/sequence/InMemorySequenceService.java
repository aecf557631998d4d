package eventsync.sequence;

import eventsync.spi.ConnectionProvider;
import eventsync.spi.EventLog;
import eventsync.spi.SequenceService;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-process sequence counters.
 *
 * <p>On first use for a tenant the counter is seeded with the highest sequence number already in
 * the durable log, so a restarted process continues at {@code max + 1} instead of reusing numbers.
 *
 * <p><b>Single writer only.</b> Two processes using this class for the same tenant will issue
 * duplicate sequence numbers. Use a shared counter (the JDBC sequence service) when more than one
 * process emits events.
 */
public final class InMemorySequenceService implements SequenceService {
  private static final Logger logger = Logger.getLogger(InMemorySequenceService.class.getName());

  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final ToLongFunction<String> seed;

  /**
   * Creates counters starting at 1 for every tenant.
   */
  public InMemorySequenceService() {
    this(tenantId -> 0L);
  }

  /**
   * Creates counters seeded lazily from {@code seed}.
   *
   * @param seed returns the highest sequence number already used by a tenant, {@code 0} if none
   */
  public InMemorySequenceService(ToLongFunction<String> seed) {
    this.seed = Objects.requireNonNull(seed, "seed");
  }

  /**
   * Creates counters seeded from the newest sequence number in a durable log.
   *
   * @param connectionProvider source of connections to the log
   * @param eventLog the durable log
   * @return a new service
   */
  public static InMemorySequenceService seededFrom(ConnectionProvider connectionProvider, EventLog eventLog) {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(eventLog, "eventLog");
    return new InMemorySequenceService(tenantId -> {
      try (Connection conn = connectionProvider.getConnection()) {
        return eventLog.newestSequence(conn, tenantId).orElse(0L);
      } catch (SQLException e) {
        throw new IllegalStateException("Failed to seed sequence for tenantId=" + tenantId, e);
      }
    });
  }

  @Override
  public long nextSequence(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    return counterFor(tenantId).incrementAndGet();
  }

  @Override
  public long currentSequence(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    return counterFor(tenantId).get();
  }

  private AtomicLong counterFor(String tenantId) {
    return counters.computeIfAbsent(tenantId, id -> new AtomicLong(seedOf(id)));
  }

  private long seedOf(String tenantId) {
    long start = seed.applyAsLong(tenantId);
    if (start < 0) {
      throw new IllegalStateException("Negative sequence seed for tenantId=" + tenantId + ": " + start);
    }
    if (start > 0) {
      logger.log(Level.FINE, "Seeded sequence for tenant {0} at {1}", new Object[]{tenantId, start});
    }
    return start;
  }
}
