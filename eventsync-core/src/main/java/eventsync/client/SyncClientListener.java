package eventsync.client;

import eventsync.presence.PresenceState;

import java.util.List;

/**
 * Notifications from a {@link SyncClient} beyond applied events. All methods default to no-ops.
 */
public interface SyncClientListener {

  SyncClientListener NOOP = new SyncClientListener() {
  };

  default void onStateChanged(SyncState previous, SyncState current) {
  }

  /**
   * The client was away longer than the server retains events. Local state derived from events
   * is stale and must be reloaded from the source of truth. Live delivery resumes afterwards.
   *
   * @param headSequence the sequence number the client resumes from
   */
  default void onFullRefreshRequired(long headSequence) {
  }

  /**
   * The reconnect policy gave up; the client is in {@link SyncState#FAILED}.
   *
   * @param attempts reconnect attempts made
   * @param lastError the last transport error, may be {@code null}
   */
  default void onGiveUp(int attempts, Throwable lastError) {
  }

  /**
   * The set of users present on an entity changed.
   *
   * @param entityType kind of record
   * @param entityId record identifier
   * @param viewers current viewers
   */
  default void onPresenceChanged(String entityType, String entityId, List<PresenceState> viewers) {
  }
}
