package eventsync.store;

import eventsync.SyncEvent;
import eventsync.spi.EventCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link EventCache}: one bounded ring per tenant holding the most recent events.
 *
 * <p>A push beyond {@code capacity} evicts the oldest entry. A tenant ring that has not been
 * written for {@code ttl} is dropped as a whole, and individual events are hidden once their
 * {@code expiresAt} passes.
 *
 * <p>Events are kept in ascending sequence order; an event that arrives out of order (possible
 * when events relayed from other processes interleave with local ones) is inserted at its place
 * and a duplicate sequence number is ignored.
 *
 * <p>This class is thread-safe.
 */
public final class RingBufferEventCache implements EventCache {
  public static final int DEFAULT_CAPACITY = 1000;

  private final Map<String, Ring> rings = new ConcurrentHashMap<>();
  private final int capacity;
  private final Duration ttl;
  private final Clock clock;

  public RingBufferEventCache() {
    this(DEFAULT_CAPACITY, SyncEvent.DEFAULT_RETENTION, Clock.systemUTC());
  }

  /**
   * @param capacity maximum events kept per tenant
   * @param ttl idle time after which a tenant's ring is dropped
   * @param clock clock used to stamp writes
   */
  public RingBufferEventCache(int capacity, Duration ttl, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.capacity = capacity;
    this.ttl = ttl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void push(SyncEvent event) {
    Objects.requireNonNull(event, "event");
    Ring ring = rings.computeIfAbsent(event.tenantId(), ignored -> new Ring());
    synchronized (ring) {
      ring.add(event, capacity);
      ring.lastWrite = clock.instant();
    }
  }

  @Override
  public List<SyncEvent> window(String tenantId, Instant now) {
    Ring ring = rings.get(tenantId);
    if (ring == null) {
      return List.of();
    }
    synchronized (ring) {
      if (ring.isIdle(now, ttl)) {
        ring.events.clear();
        return List.of();
      }
      List<SyncEvent> result = new ArrayList<>(ring.events.size());
      for (SyncEvent event : ring.events) {
        if (!event.isExpired(now)) {
          result.add(event);
        }
      }
      return result;
    }
  }

  @Override
  public int evictExpired(Instant now) {
    int evicted = 0;
    Iterator<Map.Entry<String, Ring>> it = rings.entrySet().iterator();
    while (it.hasNext()) {
      Ring ring = it.next().getValue();
      synchronized (ring) {
        if (ring.isIdle(now, ttl)) {
          evicted += ring.events.size();
          ring.events.clear();
          it.remove();
          continue;
        }
        Iterator<SyncEvent> events = ring.events.iterator();
        while (events.hasNext()) {
          if (events.next().isExpired(now)) {
            events.remove();
            evicted++;
          }
        }
      }
    }
    return evicted;
  }

  /**
   * Returns the number of events cached for a tenant, expired or not.
   *
   * @param tenantId the tenant
   * @return cached event count
   */
  public int size(String tenantId) {
    Ring ring = rings.get(tenantId);
    if (ring == null) {
      return 0;
    }
    synchronized (ring) {
      return ring.events.size();
    }
  }

  private static final class Ring {
    private final ArrayDeque<SyncEvent> events = new ArrayDeque<>();
    private Instant lastWrite = Instant.EPOCH;

    void add(SyncEvent event, int capacity) {
      SyncEvent last = events.peekLast();
      if (last == null || last.sequenceNumber() < event.sequenceNumber()) {
        events.addLast(event);
      } else {
        insertInOrder(event);
      }
      while (events.size() > capacity) {
        events.pollFirst();
      }
    }

    private void insertInOrder(SyncEvent event) {
      List<SyncEvent> copy = new ArrayList<>(events.size() + 1);
      boolean inserted = false;
      for (SyncEvent existing : events) {
        if (existing.sequenceNumber() == event.sequenceNumber()) {
          return;
        }
        if (!inserted && existing.sequenceNumber() > event.sequenceNumber()) {
          copy.add(event);
          inserted = true;
        }
        copy.add(existing);
      }
      if (!inserted) {
        copy.add(event);
      }
      events.clear();
      events.addAll(copy);
    }

    boolean isIdle(Instant now, Duration ttl) {
      return !lastWrite.plus(ttl).isAfter(now);
    }
  }
}
