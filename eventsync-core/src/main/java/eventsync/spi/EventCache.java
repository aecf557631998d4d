package eventsync.spi;

import eventsync.SyncEvent;

import java.time.Instant;
import java.util.List;

/**
 * Bounded most-recent window of each tenant's events: the fast path of the event store.
 *
 * <p>The cache may lose events at any time (capacity roll-over, TTL, restart); the durable log
 * remains the reference for catch-up.
 */
public interface EventCache {

  /**
   * Adds an event to its tenant's window, evicting the oldest entry when full.
   *
   * @param event the event
   */
  void push(SyncEvent event);

  /**
   * Returns the unexpired cached events of a tenant in ascending sequence order.
   *
   * @param tenantId the tenant
   * @param now reference instant for expiry
   * @return a snapshot, never {@code null}
   */
  List<SyncEvent> window(String tenantId, Instant now);

  /**
   * Drops expired entries and idle tenant windows.
   *
   * @param now reference instant
   * @return number of events evicted
   */
  int evictExpired(Instant now);
}
