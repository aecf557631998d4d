package eventsync.presence;

import eventsync.spi.PresenceStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks which users currently have which shared records open.
 *
 * <p>Each record lives for {@link #DEFAULT_TTL} after its last update; clients refresh it with a
 * heartbeat every {@link #HEARTBEAT_INTERVAL}. Expired records are never returned. Expiry is
 * silent: nobody is told when a record times out.
 *
 * <p>Store failures are logged and swallowed; presence is advisory.
 */
public final class PresenceTracker {
  private static final Logger logger = Logger.getLogger(PresenceTracker.class.getName());

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
  public static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

  private final PresenceStore store;
  private final Duration ttl;
  private final Clock clock;

  public PresenceTracker(PresenceStore store) {
    this(store, DEFAULT_TTL, Clock.systemUTC());
  }

  public PresenceTracker(PresenceStore store, Duration ttl, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records a user's action on an entity and resets the record's TTL.
   *
   * <p>{@link PresenceAction#HEARTBEAT} keeps the last explicit action, or starts the record as
   * {@link PresenceAction#VIEWING} if none exists. {@link PresenceAction#LEFT} removes the
   * record.
   *
   * @param tenantId the tenant
   * @param userId the user
   * @param userName display name, may be {@code null} to keep the current one
   * @param entityType kind of record
   * @param entityId record identifier
   * @param action the reported action
   * @return the resulting change, empty if nothing changed or the store failed
   */
  public Optional<PresenceChange> trackPresence(String tenantId, String userId, String userName,
      String entityType, String entityId, PresenceAction action) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(action, "action");
    PresenceKey key = new PresenceKey(tenantId, entityType, entityId);
    if (action == PresenceAction.LEFT) {
      return leave(key, userId);
    }
    Instant now = clock.instant();
    PresenceState[] previous = new PresenceState[1];
    try {
      PresenceState next = store.upsert(key, userId, current -> {
        previous[0] = current;
        PresenceAction state = action.isState()
            ? action
            : current != null ? current.action() : PresenceAction.VIEWING;
        String name = userName != null ? userName : current != null ? current.userName() : null;
        return new PresenceState(userId, name, entityType, entityId, state, now);
      }, ttl, now);
      return Optional.of(new PresenceChange(kindOf(previous[0], next), next));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to track presence of user " + userId + " on " + key, e);
      return Optional.empty();
    }
  }

  private Optional<PresenceChange> leave(PresenceKey key, String userId) {
    try {
      Optional<PresenceState> current = store.get(key, userId, clock.instant());
      boolean removed = store.remove(key, userId);
      if (removed && current.isPresent()) {
        return Optional.of(new PresenceChange(PresenceChange.Kind.LEFT, current.get()));
      }
      return Optional.empty();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to remove presence of user " + userId + " on " + key, e);
      return Optional.empty();
    }
  }

  private static PresenceChange.Kind kindOf(PresenceState previous, PresenceState next) {
    if (previous == null) {
      return PresenceChange.Kind.JOINED;
    }
    if (previous.action() != next.action() || !Objects.equals(previous.userName(), next.userName())) {
      return PresenceChange.Kind.UPDATED;
    }
    return PresenceChange.Kind.REFRESHED;
  }

  /**
   * Returns the unexpired presence records for an entity, ordered by user id.
   *
   * @param tenantId the tenant
   * @param entityType kind of record
   * @param entityId record identifier
   * @return current viewers, empty if the store failed
   */
  public List<PresenceState> getPresence(String tenantId, String entityType, String entityId) {
    PresenceKey key = new PresenceKey(tenantId, entityType, entityId);
    try {
      return store.list(key, clock.instant());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read presence for " + key, e);
      return List.of();
    }
  }

  /**
   * Removes one user's record on one entity.
   *
   * @return the removal, empty if there was no live record
   */
  public Optional<PresenceChange> removePresence(String tenantId, String userId, String entityType,
      String entityId) {
    return leave(new PresenceKey(tenantId, entityType, entityId), userId);
  }

  /**
   * Removes every record the user holds in the tenant, for example when their last connection
   * closes.
   *
   * @param tenantId the tenant
   * @param userId the user
   * @return keys of the removed records
   */
  public List<PresenceKey> removePresence(String tenantId, String userId) {
    try {
      return store.removeAll(tenantId, userId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to remove presence of user " + userId + " in tenant " + tenantId, e);
      return List.of();
    }
  }

  /**
   * Physically removes expired records.
   *
   * @return number of records removed
   */
  public int sweep() {
    try {
      int swept = store.sweep(clock.instant());
      if (swept > 0) {
        logger.log(Level.FINE, "Swept {0} expired presence records", swept);
      }
      return swept;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Presence sweep failed", e);
      return 0;
    }
  }
}
