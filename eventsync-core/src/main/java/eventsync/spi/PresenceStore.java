package eventsync.spi;

import eventsync.presence.PresenceKey;
import eventsync.presence.PresenceState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Shared key-value structure for presence: one record per user under each
 * {@code (tenant, entityType, entityId)} key, each with its own time-to-live.
 *
 * <p>Reads must never return a record whose TTL has elapsed. Upserts are atomic per user; there
 * is no locking across users.
 */
public interface PresenceStore {

  /**
   * Atomically replaces the user's record under {@code key}, resetting its TTL.
   *
   * @param key the entity key
   * @param userId the user
   * @param update receives the current live record (or {@code null}) and returns the new one
   * @param ttl time-to-live of the stored record
   * @param now reference instant
   * @return the stored record
   */
  PresenceState upsert(PresenceKey key, String userId, UnaryOperator<PresenceState> update,
      Duration ttl, Instant now);

  /**
   * Returns the user's live record under {@code key}.
   *
   * @param key the entity key
   * @param userId the user
   * @param now reference instant
   * @return the record, or empty if absent or expired
   */
  Optional<PresenceState> get(PresenceKey key, String userId, Instant now);

  /**
   * Returns all live records under {@code key}.
   *
   * @param key the entity key
   * @param now reference instant
   * @return live records, never {@code null}
   */
  List<PresenceState> list(PresenceKey key, Instant now);

  /**
   * Removes the user's record under {@code key}.
   *
   * @param key the entity key
   * @param userId the user
   * @return {@code true} if a live record was removed
   */
  boolean remove(PresenceKey key, String userId);

  /**
   * Removes every record of the user within the tenant.
   *
   * @param tenantId the tenant
   * @param userId the user
   * @return the keys a record was removed from
   */
  List<PresenceKey> removeAll(String tenantId, String userId);

  /**
   * Physically deletes expired records.
   *
   * @param now reference instant
   * @return number of records deleted
   */
  int sweep(Instant now);
}
