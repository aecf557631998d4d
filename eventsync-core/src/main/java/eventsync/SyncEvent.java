package eventsync;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable change notification on a tenant's event stream.
 *
 * <p>Every event carries a globally unique {@code id} (UUID, the deduplication key) and a
 * {@code sequenceNumber} that is strictly increasing within its tenant. The payload is a JSON
 * object limited to {@value #MAX_PAYLOAD_BYTES} bytes. Events are created once by
 * {@link EventEmitter} and never mutated; the store purges them after {@link #expiresAt()}.
 *
 * @see EventEmitter
 * @see EventType
 */
public final class SyncEvent {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB
  public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

  private final String id;
  private final long sequenceNumber;
  private final String tenantId;
  private final EventType eventType;
  private final String payloadJson;
  private final String userId;
  private final Instant timestamp;
  private final Instant expiresAt;

  private SyncEvent(Builder builder) {
    this.id = builder.id == null ? UUID.randomUUID().toString() : builder.id;
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId");
    if (tenantId.isEmpty()) {
      throw new IllegalArgumentException("tenantId cannot be empty");
    }
    if (builder.sequenceNumber <= 0) {
      throw new IllegalArgumentException("sequenceNumber must be > 0, got: " + builder.sequenceNumber);
    }
    this.sequenceNumber = builder.sequenceNumber;

    if (eventType.isUserScoped() && (builder.userId == null || builder.userId.isEmpty())) {
      throw new IllegalArgumentException("userId is required for " + eventType.wireName());
    }
    this.userId = builder.userId;

    String payload = builder.payloadJson == null ? "{}" : builder.payloadJson;
    if (payload.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
    this.payloadJson = payload;

    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    if (builder.expiresAt != null) {
      if (builder.expiresAt.isBefore(timestamp)) {
        throw new IllegalArgumentException("expiresAt must not be before timestamp");
      }
      this.expiresAt = builder.expiresAt;
    } else {
      this.expiresAt = timestamp.plus(DEFAULT_RETENTION);
    }
  }

  /**
   * Creates a builder for an event of the given type.
   *
   * @param eventType the event type
   * @return a new builder
   */
  public static Builder builder(EventType eventType) {
    return new Builder(Objects.requireNonNull(eventType, "eventType"));
  }

  public String id() {
    return id;
  }

  public long sequenceNumber() {
    return sequenceNumber;
  }

  public String tenantId() {
    return tenantId;
  }

  public EventType eventType() {
    return eventType;
  }

  public String payloadJson() {
    return payloadJson;
  }

  /**
   * Returns the targeted user for user-scoped events, or {@code null}.
   *
   * @return the user id, or {@code null}
   */
  public String userId() {
    return userId;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  /**
   * Returns {@code true} if the retention boundary has passed at {@code now}.
   *
   * @param now the reference instant
   * @return whether this event is expired
   */
  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  /**
   * Returns {@code true} if a connection owned by {@code connectionUserId} may see this event.
   * Tenant-wide events are visible to everyone in the tenant.
   *
   * @param connectionUserId user owning the connection, may be {@code null}
   * @return whether the event may be delivered to that user
   */
  public boolean isVisibleTo(String connectionUserId) {
    return userId == null || userId.equals(connectionUserId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SyncEvent other)) return false;
    return id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("SyncEvent{id=").append(id)
        .append(", tenantId=").append(tenantId)
        .append(", sequenceNumber=").append(sequenceNumber)
        .append(", eventType=").append(eventType.wireName());
    if (userId != null) {
      sb.append(", userId=").append(userId);
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link SyncEvent}.
   */
  public static final class Builder {
    private final EventType eventType;
    private String id;
    private long sequenceNumber;
    private String tenantId;
    private String payloadJson;
    private String userId;
    private Instant timestamp;
    private Instant expiresAt;

    private Builder(EventType eventType) {
      this.eventType = eventType;
    }

    /**
     * Sets the event identifier.
     *
     * <p>Optional. Defaults to a random UUID.
     *
     * @param id the event identifier
     * @return this builder
     */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /**
     * Sets the tenant-local sequence number.
     *
     * <p><b>Required.</b> Must be &gt; 0.
     *
     * @param sequenceNumber the sequence number
     * @return this builder
     */
    public Builder sequenceNumber(long sequenceNumber) {
      this.sequenceNumber = sequenceNumber;
      return this;
    }

    /**
     * Sets the owning tenant.
     *
     * <p><b>Required.</b>
     *
     * @param tenantId the tenant identifier
     * @return this builder
     */
    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    /**
     * Sets the JSON payload.
     *
     * <p>Optional. Defaults to {@code {}}.
     *
     * @param payloadJson the JSON object text
     * @return this builder
     */
    public Builder payloadJson(String payloadJson) {
      this.payloadJson = payloadJson;
      return this;
    }

    /**
     * Sets the targeted user. Required for user-scoped types.
     *
     * @param userId the user identifier
     * @return this builder
     */
    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    /**
     * Sets the creation time.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param timestamp the creation time
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Sets the retention boundary.
     *
     * <p>Optional. Defaults to {@code timestamp + 24h}.
     *
     * @param expiresAt the instant after which the event may be purged
     * @return this builder
     */
    public Builder expiresAt(Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    /**
     * Builds an immutable {@link SyncEvent}.
     *
     * @return a new event
     * @throws IllegalArgumentException if the sequence number is not positive, the payload is too
     *     large, {@code expiresAt} precedes {@code timestamp}, or a user-scoped type has no user
     */
    public SyncEvent build() {
      return new SyncEvent(this);
    }
  }
}
