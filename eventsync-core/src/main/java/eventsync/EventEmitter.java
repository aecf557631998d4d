package eventsync;

import eventsync.broadcast.ConnectionRegistry;
import eventsync.protocol.ProtocolException;
import eventsync.protocol.WireCodec;
import eventsync.spi.ClusterRelay;
import eventsync.spi.MetricsExporter;
import eventsync.spi.SequenceService;
import eventsync.spi.TxContext;
import eventsync.store.TieredEventStore;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for mutation handlers: turns a committed change into a sequenced event, stores it
 * and fans it out.
 *
 * <p>Emission is best effort. It never throws for store, broadcast or relay failures; those are
 * logged and counted, and clients recover through catch-up or a full refresh. Only argument
 * errors (null tenant, unknown type) surface as exceptions.
 *
 * <p>Within one process, emissions for the same tenant are serialized so that local clients see
 * events in sequence order. Tenants never wait for each other.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // inside a service method, after the lead was saved
 * emitter.emitLeadUpdated(tenantId, Map.of("id", lead.getId(), "status", lead.getStatus()));
 *
 * // or deferred until the surrounding transaction commits
 * emitter.emitAfterCommit(tenantId, EventType.CASE_CREATED, caseJson, null);
 * }</pre>
 */
public final class EventEmitter {
  private static final Logger logger = Logger.getLogger(EventEmitter.class.getName());

  private final SequenceService sequenceService;
  private final TieredEventStore store;
  private final ConnectionRegistry registry;
  private final ClusterRelay relay;
  private final MetricsExporter metrics;
  private final TxContext txContext;
  private final Clock clock;
  private final Duration retention;
  private final Map<String, Object> tenantLocks = new ConcurrentHashMap<>();

  EventEmitter(SequenceService sequenceService, TieredEventStore store, ConnectionRegistry registry,
      ClusterRelay relay, MetricsExporter metrics, TxContext txContext, Clock clock, Duration retention) {
    this.sequenceService = Objects.requireNonNull(sequenceService, "sequenceService");
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.relay = relay != null ? relay : ClusterRelay.NOOP;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.txContext = txContext;
    this.clock = clock != null ? clock : Clock.systemUTC();
    this.retention = retention != null ? retention : SyncEvent.DEFAULT_RETENTION;
  }

  /**
   * Emits an event now.
   *
   * @param tenantId the tenant
   * @param eventType the event type
   * @param payloadJson JSON object text, {@code null} for {@code {}}
   * @param userId the targeted user, required for user-scoped types, otherwise optional
   * @return the emitted event, or empty if emission failed
   * @throws IllegalArgumentException if a user-scoped type has no user
   */
  public Optional<SyncEvent> emit(String tenantId, EventType eventType, String payloadJson, String userId) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(eventType, "eventType");
    if (eventType.isUserScoped() && (userId == null || userId.isEmpty())) {
      throw new IllegalArgumentException("userId is required for " + eventType.wireName());
    }
    String payload;
    try {
      payload = WireCodec.normalizePayload(payloadJson);
    } catch (ProtocolException e) {
      metrics.incrementEmitFailure();
      logger.log(Level.SEVERE, "Rejected " + eventType.wireName() + " for tenant " + tenantId
          + ": payload is not a JSON object", e);
      return Optional.empty();
    }
    if (payload.getBytes(StandardCharsets.UTF_8).length > SyncEvent.MAX_PAYLOAD_BYTES) {
      metrics.incrementEmitFailure();
      logger.log(Level.SEVERE, "Rejected {0} for tenant {1}: payload exceeds {2} bytes",
          new Object[]{eventType.wireName(), tenantId, SyncEvent.MAX_PAYLOAD_BYTES});
      return Optional.empty();
    }

    Object lock = tenantLocks.computeIfAbsent(tenantId, ignored -> new Object());
    synchronized (lock) {
      SyncEvent event;
      try {
        Instant now = clock.instant();
        event = SyncEvent.builder(eventType)
            .sequenceNumber(sequenceService.nextSequence(tenantId))
            .tenantId(tenantId)
            .payloadJson(payload)
            .userId(userId)
            .timestamp(now)
            .expiresAt(now.plus(retention))
            .build();
      } catch (RuntimeException e) {
        metrics.incrementEmitFailure();
        logger.log(Level.SEVERE, "Failed to allocate sequence for " + eventType.wireName()
            + " in tenant " + tenantId, e);
        return Optional.empty();
      }
      store.store(event);
      try {
        registry.broadcastEvent(event);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Broadcast failed for " + event, e);
      }
      try {
        relay.publish(event);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Relay publish failed for " + event, e);
      }
      metrics.incrementEmitted();
      return Optional.of(event);
    }
  }

  /**
   * Emits an event whose payload is serialized from a map, record or bean.
   *
   * @return the emitted event, or empty if emission failed
   */
  public Optional<SyncEvent> emit(String tenantId, EventType eventType, Object payload, String userId) {
    String json;
    try {
      json = WireCodec.payloadOf(payload);
    } catch (RuntimeException e) {
      metrics.incrementEmitFailure();
      logger.log(Level.SEVERE, "Failed to serialize payload of " + eventType.wireName(), e);
      return Optional.empty();
    }
    return emit(tenantId, eventType, json, userId);
  }

  /**
   * Emits the event once the caller's transaction commits, or immediately when no transaction is
   * active. Nothing is emitted if the transaction rolls back.
   *
   * @param tenantId the tenant
   * @param eventType the event type
   * @param payloadJson JSON object text
   * @param userId the targeted user, may be {@code null} for tenant-wide types
   */
  public void emitAfterCommit(String tenantId, EventType eventType, String payloadJson, String userId) {
    if (txContext == null || !txContext.isTransactionActive()) {
      emit(tenantId, eventType, payloadJson, userId);
      return;
    }
    txContext.afterCommit(() -> emit(tenantId, eventType, payloadJson, userId));
  }

  public Optional<SyncEvent> emitLeadCreated(String tenantId, Object lead) {
    return emit(tenantId, EventType.LEAD_CREATED, lead, null);
  }

  public Optional<SyncEvent> emitLeadUpdated(String tenantId, Object lead) {
    return emit(tenantId, EventType.LEAD_UPDATED, lead, null);
  }

  public Optional<SyncEvent> emitLeadDeleted(String tenantId, String leadId) {
    return emit(tenantId, EventType.LEAD_DELETED, Map.of("leadId", leadId), null);
  }

  public Optional<SyncEvent> emitCaseCreated(String tenantId, Object caseData) {
    return emit(tenantId, EventType.CASE_CREATED, caseData, null);
  }

  public Optional<SyncEvent> emitCaseUpdated(String tenantId, Object caseData) {
    return emit(tenantId, EventType.CASE_UPDATED, caseData, null);
  }

  public Optional<SyncEvent> emitCaseDeleted(String tenantId, String caseId) {
    return emit(tenantId, EventType.CASE_DELETED, Map.of("caseId", caseId), null);
  }

  public Optional<SyncEvent> emitDocumentCreated(String tenantId, Object document) {
    return emit(tenantId, EventType.DOCUMENT_CREATED, document, null);
  }

  public Optional<SyncEvent> emitDocumentUpdated(String tenantId, Object document) {
    return emit(tenantId, EventType.DOCUMENT_UPDATED, document, null);
  }

  public Optional<SyncEvent> emitDocumentDeleted(String tenantId, String documentId) {
    return emit(tenantId, EventType.DOCUMENT_DELETED, Map.of("documentId", documentId), null);
  }

  /** Tells the user's clients that their session was ended server-side. */
  public Optional<SyncEvent> emitSessionInvalidated(String tenantId, String userId, Object payload) {
    return emit(tenantId, EventType.SESSION_INVALIDATED, payload, userId);
  }

  public Optional<SyncEvent> emitPermissionsChanged(String tenantId, String userId, Object payload) {
    return emit(tenantId, EventType.PERMISSIONS_CHANGED, payload, userId);
  }

  public Optional<SyncEvent> emitAccountLocked(String tenantId, String userId, Object payload) {
    return emit(tenantId, EventType.ACCOUNT_LOCKED, payload, userId);
  }

  public Optional<SyncEvent> emitSessionExpiring(String tenantId, String userId, Object payload) {
    return emit(tenantId, EventType.SESSION_EXPIRING, payload, userId);
  }
}
