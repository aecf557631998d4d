package eventsync;

import eventsync.spi.ConnectionProvider;
import eventsync.spi.EventLog;
import eventsync.spi.EventPurger;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event log kept in memory, with a switch to simulate an unavailable database.
 */
public final class InMemoryEventLog implements EventLog, EventPurger {
  private final Map<String, TreeMap<Long, SyncEvent>> tenants = new ConcurrentHashMap<>();
  private final AtomicInteger appends = new AtomicInteger();
  private final AtomicInteger reads = new AtomicInteger();
  private volatile boolean failing;

  /**
   * Returns a provider of connections that do nothing. Every method answers with its type's
   * default value, which is all the store needs around an in-memory log.
   */
  public static ConnectionProvider connections() {
    return () -> (Connection) Proxy.newProxyInstance(
        InMemoryEventLog.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          Class<?> type = method.getReturnType();
          if (type == boolean.class) {
            return false;
          }
          if (type == int.class) {
            return 0;
          }
          if (type == String.class) {
            return "stub-connection";
          }
          return null;
        });
  }

  public void failing(boolean failing) {
    this.failing = failing;
  }

  public int appends() {
    return appends.get();
  }

  public int reads() {
    return reads.get();
  }

  public List<SyncEvent> events(String tenantId) {
    TreeMap<Long, SyncEvent> rows = tenants.get(tenantId);
    if (rows == null) {
      return List.of();
    }
    synchronized (rows) {
      return new ArrayList<>(rows.values());
    }
  }

  public void delete(String tenantId, long sequenceNumber) {
    TreeMap<Long, SyncEvent> rows = tenants.get(tenantId);
    if (rows != null) {
      synchronized (rows) {
        rows.remove(sequenceNumber);
      }
    }
  }

  @Override
  public void append(Connection conn, SyncEvent event) {
    checkAvailable();
    TreeMap<Long, SyncEvent> rows = tenants.computeIfAbsent(event.tenantId(), ignored -> new TreeMap<>());
    synchronized (rows) {
      if (rows.putIfAbsent(event.sequenceNumber(), event) != null) {
        throw new IllegalStateException("duplicate sequence " + event.sequenceNumber());
      }
    }
    appends.incrementAndGet();
  }

  @Override
  public List<SyncEvent> findSince(Connection conn, String tenantId, long since, Instant now, int limit) {
    checkAvailable();
    reads.incrementAndGet();
    List<SyncEvent> result = new ArrayList<>();
    TreeMap<Long, SyncEvent> rows = tenants.get(tenantId);
    if (rows == null) {
      return result;
    }
    synchronized (rows) {
      for (SyncEvent event : rows.tailMap(since, false).values()) {
        if (result.size() == limit) {
          break;
        }
        if (event.expiresAt().isAfter(now)) {
          result.add(event);
        }
      }
    }
    return result;
  }

  @Override
  public OptionalLong oldestSequence(Connection conn, String tenantId, Instant now) {
    checkAvailable();
    TreeMap<Long, SyncEvent> rows = tenants.get(tenantId);
    if (rows == null) {
      return OptionalLong.empty();
    }
    synchronized (rows) {
      for (SyncEvent event : rows.values()) {
        if (event.expiresAt().isAfter(now)) {
          return OptionalLong.of(event.sequenceNumber());
        }
      }
      return OptionalLong.empty();
    }
  }

  @Override
  public OptionalLong newestSequence(Connection conn, String tenantId) {
    checkAvailable();
    TreeMap<Long, SyncEvent> rows = tenants.get(tenantId);
    if (rows == null) {
      return OptionalLong.empty();
    }
    synchronized (rows) {
      return rows.isEmpty() ? OptionalLong.empty() : OptionalLong.of(rows.lastKey());
    }
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    checkAvailable();
    List<SyncEvent> expired = new ArrayList<>();
    for (TreeMap<Long, SyncEvent> rows : tenants.values()) {
      synchronized (rows) {
        for (SyncEvent event : rows.values()) {
          if (event.expiresAt().isBefore(before)) {
            expired.add(event);
          }
        }
      }
    }
    expired.sort(Comparator.comparing(SyncEvent::expiresAt));
    int deleted = 0;
    for (SyncEvent event : expired) {
      if (deleted == limit) {
        break;
      }
      delete(event.tenantId(), event.sequenceNumber());
      deleted++;
    }
    return deleted;
  }

  private void checkAvailable() {
    if (failing) {
      throw new IllegalStateException("event log unavailable");
    }
  }
}
