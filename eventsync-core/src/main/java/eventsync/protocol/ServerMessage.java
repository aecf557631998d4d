package eventsync.protocol;

import eventsync.SyncEvent;
import eventsync.presence.PresenceChange;
import eventsync.presence.PresenceState;

import java.util.List;
import java.util.Objects;

/**
 * Frames sent from the server to a client.
 */
public sealed interface ServerMessage permits ServerMessage.EventPush, ServerMessage.SyncResponse,
    ServerMessage.Ping, ServerMessage.PresenceNotice, ServerMessage.InitialPresence {

  /** A live event. Encoded as the bare event object. */
  record EventPush(SyncEvent event) implements ServerMessage {
    public EventPush {
      Objects.requireNonNull(event, "event");
    }
  }

  /**
   * One page of catch-up.
   *
   * @param events events above the requested cursor, ascending
   * @param hasMore more events remain; the client must send another {@code sync}
   * @param gap the cursor predates retention; the client must refresh in full
   * @param unavailable the server could not read its store; the client should retry later
   * @param lastSequenceNumber the cursor the client should hold after applying this page
   */
  record SyncResponse(List<SyncEvent> events, boolean hasMore, boolean gap, boolean unavailable,
      long lastSequenceNumber) implements ServerMessage {
    public SyncResponse {
      events = List.copyOf(Objects.requireNonNull(events, "events"));
    }
  }

  /** Keep-alive ping; the client answers with a pong. */
  record Ping() implements ServerMessage {
  }

  /**
   * Another user joined, changed or left an entity.
   *
   * @param kind joined, updated or left
   * @param presence the record concerned
   */
  record PresenceNotice(PresenceChange.Kind kind, PresenceState presence) implements ServerMessage {
    public PresenceNotice {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(presence, "presence");
      if (!kind.isBroadcast()) {
        throw new IllegalArgumentException("kind is not announced: " + kind);
      }
    }
  }

  /**
   * Current viewers of an entity, sent to a user when they join it.
   */
  record InitialPresence(String entityType, String entityId, List<PresenceState> users)
      implements ServerMessage {
    public InitialPresence {
      Objects.requireNonNull(entityType, "entityType");
      Objects.requireNonNull(entityId, "entityId");
      users = List.copyOf(Objects.requireNonNull(users, "users"));
    }
  }
}
