package eventsync.protocol;

import eventsync.EventType;
import eventsync.presence.PresenceAction;

import java.util.Objects;
import java.util.Set;

/**
 * Frames sent from a client to the server. Each carries an {@code action} field on the wire,
 * except {@link Pong} which uses {@code type}.
 */
public sealed interface ClientMessage
    permits ClientMessage.Subscribe, ClientMessage.Sync, ClientMessage.Presence, ClientMessage.Pong {

  /**
   * Restricts live and catch-up delivery to the given event types. An empty set means all.
   *
   * @param events subscribed types
   */
  record Subscribe(Set<EventType> events) implements ClientMessage {
    public Subscribe {
      events = Set.copyOf(Objects.requireNonNull(events, "events"));
    }
  }

  /**
   * Requests every event above the client's cursor.
   *
   * @param lastEventId highest sequence number the client has applied
   */
  record Sync(long lastEventId) implements ClientMessage {
    public Sync {
      if (lastEventId < 0) {
        throw new IllegalArgumentException("lastEventId must be >= 0");
      }
    }
  }

  /**
   * Reports the sender's presence on an entity. {@code userId} and {@code userName} are
   * optional on heartbeats and leaves.
   */
  record Presence(String entityType, String entityId, PresenceAction action, String userId,
      String userName) implements ClientMessage {
    public Presence {
      Objects.requireNonNull(entityType, "entityType");
      Objects.requireNonNull(entityId, "entityId");
      Objects.requireNonNull(action, "action");
    }
  }

  /**
   * Answer to a server ping.
   *
   * @param lastEventId the client's cursor at the time of the answer
   */
  record Pong(long lastEventId) implements ClientMessage {
  }
}
