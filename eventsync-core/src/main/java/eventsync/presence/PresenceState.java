package eventsync.presence;

import java.time.Instant;
import java.util.Objects;

/**
 * One user's presence on one entity, as of its last heartbeat.
 *
 * @param userId the present user
 * @param userName display name, falls back to {@code userId}
 * @param entityType kind of record
 * @param entityId record identifier
 * @param action current state, never {@link PresenceAction#HEARTBEAT} or {@link PresenceAction#LEFT}
 * @param timestamp time of the last update or heartbeat
 */
public record PresenceState(
    String userId,
    String userName,
    String entityType,
    String entityId,
    PresenceAction action,
    Instant timestamp) {

  public PresenceState {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(timestamp, "timestamp");
    if (!action.isState()) {
      throw new IllegalArgumentException("action must be a presence state, got: " + action);
    }
    if (userName == null || userName.isEmpty()) {
      userName = userId;
    }
  }

  PresenceState refreshed(Instant now) {
    return new PresenceState(userId, userName, entityType, entityId, action, now);
  }
}
