package eventsync.presence;

import java.util.Objects;

/**
 * Outcome of a presence update, used to decide what other users are told.
 *
 * @param kind what happened to the record
 * @param state the record after the update, or the removed record for {@link Kind#LEFT}
 */
public record PresenceChange(Kind kind, PresenceState state) {

  public PresenceChange {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(state, "state");
  }

  public enum Kind {
    /** A record was created. */
    JOINED("presence_joined"),
    /** The action or the display name of an existing record changed. */
    UPDATED("presence_updated"),
    /** Only the TTL was refreshed. Not broadcast. */
    REFRESHED(null),
    /** The user left explicitly. */
    LEFT("presence_left");

    private final String messageType;

    Kind(String messageType) {
      this.messageType = messageType;
    }

    /**
     * Returns the wire message type announcing this change, or {@code null} if it is silent.
     *
     * @return the message type, or {@code null}
     */
    public String messageType() {
      return messageType;
    }

    public boolean isBroadcast() {
      return messageType != null;
    }
  }
}
