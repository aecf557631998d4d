package eventsync.client;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Remembers the ids of the most recently applied events so that an event delivered both live
 * and through catch-up is applied once.
 *
 * <p>Holds at most {@code capacity} ids; the oldest id is forgotten first. This class is
 * thread-safe.
 */
public final class DeduplicationFilter {
  public static final int DEFAULT_CAPACITY = 1000;

  private final int capacity;
  private final ArrayDeque<String> order;
  private final Set<String> seen;

  public DeduplicationFilter() {
    this(DEFAULT_CAPACITY);
  }

  public DeduplicationFilter(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.capacity = capacity;
    this.order = new ArrayDeque<>(capacity);
    this.seen = new HashSet<>(capacity * 2);
  }

  /**
   * Returns {@code true} if the id was seen before; otherwise records it and returns
   * {@code false}.
   *
   * @param eventId the event id
   * @return whether the event was already applied
   */
  public synchronized boolean isDuplicate(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    if (!seen.add(eventId)) {
      return true;
    }
    order.addLast(eventId);
    if (order.size() > capacity) {
      seen.remove(order.pollFirst());
    }
    return false;
  }

  public synchronized int size() {
    return order.size();
  }

  public synchronized void clear() {
    order.clear();
    seen.clear();
  }
}
