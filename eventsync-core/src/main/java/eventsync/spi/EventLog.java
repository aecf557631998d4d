package eventsync.spi;

import eventsync.SyncEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

/**
 * Durable, append-only event log keyed by {@code (tenantId, sequenceNumber)}.
 *
 * <p>This is the cold path of the event store: it serves catch-up requests the cache cannot
 * answer and seeds sequence counters after a restart. Implementations throw an unchecked
 * exception on database failure; callers decide whether the failure is fatal.
 *
 * @see eventsync.store.TieredEventStore
 */
public interface EventLog {

  /**
   * Appends an event.
   *
   * @param conn the connection to use
   * @param event the event to persist
   */
  void append(Connection conn, SyncEvent event);

  /**
   * Returns unexpired events of {@code tenantId} with {@code sequenceNumber > since}, ascending.
   * Rows whose {@code expiresAt} is not after {@code now} are left out even before they are
   * purged.
   *
   * @param conn the connection to use
   * @param tenantId the tenant
   * @param since exclusive lower bound
   * @param now reference instant for expiry
   * @param limit maximum number of rows
   * @return ordered events, never {@code null}
   */
  List<SyncEvent> findSince(Connection conn, String tenantId, long since, Instant now, int limit);

  /**
   * Returns the smallest sequence number of the tenant that has not expired at {@code now}.
   *
   * @param conn the connection to use
   * @param tenantId the tenant
   * @param now reference instant for expiry
   * @return the oldest retained sequence number, or empty if the tenant has no live rows
   */
  OptionalLong oldestSequence(Connection conn, String tenantId, Instant now);

  /**
   * Returns the largest sequence number stored for the tenant.
   *
   * @param conn the connection to use
   * @param tenantId the tenant
   * @return the newest sequence number, or empty if the tenant has no rows
   */
  OptionalLong newestSequence(Connection conn, String tenantId);
}
