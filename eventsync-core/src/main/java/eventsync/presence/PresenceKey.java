package eventsync.presence;

import java.util.Objects;

/**
 * Identifies one shared record that users can be present on.
 *
 * @param tenantId owning tenant
 * @param entityType kind of record, for example {@code lead}
 * @param entityId record identifier
 */
public record PresenceKey(String tenantId, String entityType, String entityId) {

  public PresenceKey {
    requireText(tenantId, "tenantId");
    requireText(entityType, "entityType");
    requireText(entityId, "entityId");
  }

  private static void requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isEmpty()) {
      throw new IllegalArgumentException(name + " cannot be empty");
    }
  }
}
