package eventsync;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of change notifications carried on a tenant's event stream.
 *
 * <p>Each constant knows its wire name, the kind of record it concerns and whether it is
 * <em>user-scoped</em>. User-scoped events (session lifecycle) are delivered only to the
 * connections of the targeted user, never to the whole tenant.
 */
public enum EventType {
  LEAD_CREATED("lead_created", EntityKind.LEAD),
  LEAD_UPDATED("lead_updated", EntityKind.LEAD),
  LEAD_DELETED("lead_deleted", EntityKind.LEAD),
  CASE_CREATED("case_created", EntityKind.CASE),
  CASE_UPDATED("case_updated", EntityKind.CASE),
  CASE_DELETED("case_deleted", EntityKind.CASE),
  DOCUMENT_CREATED("document_created", EntityKind.DOCUMENT),
  DOCUMENT_UPDATED("document_updated", EntityKind.DOCUMENT),
  DOCUMENT_DELETED("document_deleted", EntityKind.DOCUMENT),
  SESSION_INVALIDATED("session_invalidated", EntityKind.SESSION),
  PERMISSIONS_CHANGED("permissions_changed", EntityKind.SESSION),
  ACCOUNT_LOCKED("account_locked", EntityKind.SESSION),
  SESSION_EXPIRING("session_expiring", EntityKind.SESSION);

  private static final Map<String, EventType> BY_WIRE_NAME;

  static {
    Map<String, EventType> byName = new HashMap<>();
    for (EventType type : values()) {
      byName.put(type.wireName, type);
    }
    BY_WIRE_NAME = Collections.unmodifiableMap(byName);
  }

  private final String wireName;
  private final EntityKind entityKind;

  EventType(String wireName, EntityKind entityKind) {
    this.wireName = wireName;
    this.entityKind = entityKind;
  }

  /**
   * Returns the name used on the wire and in the durable log, e.g. {@code lead_created}.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  public EntityKind entityKind() {
    return entityKind;
  }

  /**
   * Returns {@code true} for session lifecycle events that target a single user.
   *
   * @return whether delivery is restricted to one user's connections
   */
  public boolean isUserScoped() {
    return entityKind == EntityKind.SESSION;
  }

  /**
   * Resolves a wire name.
   *
   * @param wireName the wire name, e.g. {@code case_deleted}
   * @return the matching type, or empty if unknown
   */
  public static Optional<EventType> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }

  /**
   * Resolves a wire name, failing on unknown names.
   *
   * @param wireName the wire name
   * @return the matching type
   * @throws IllegalArgumentException if the name is not part of the closed set
   */
  public static EventType ofWireName(String wireName) {
    return fromWireName(wireName)
        .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + wireName));
  }

  /** Kind of record an event refers to. */
  public enum EntityKind {
    LEAD("lead"),
    CASE("case"),
    DOCUMENT("document"),
    SESSION("session");

    private final String wireName;

    EntityKind(String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }
  }
}
