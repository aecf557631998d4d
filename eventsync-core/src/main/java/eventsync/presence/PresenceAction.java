package eventsync.presence;

import java.util.Optional;

/**
 * Actions a client reports for an entity it has open.
 *
 * <p>{@link #VIEWING}, {@link #EDITING} and {@link #IDLE} are states that a presence record can
 * hold. {@link #HEARTBEAT} only refreshes the record's TTL and {@link #LEFT} removes it.
 */
public enum PresenceAction {
  VIEWING("viewing"),
  EDITING("editing"),
  IDLE("idle"),
  HEARTBEAT("heartbeat"),
  LEFT("left");

  private final String wireName;

  PresenceAction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Returns {@code true} for actions that a presence record can hold.
   *
   * @return whether this action is a presence state
   */
  public boolean isState() {
    return this == VIEWING || this == EDITING || this == IDLE;
  }

  public static Optional<PresenceAction> fromWireName(String wireName) {
    for (PresenceAction action : values()) {
      if (action.wireName.equals(wireName)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
