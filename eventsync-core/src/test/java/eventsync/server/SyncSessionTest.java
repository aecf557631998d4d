package eventsync.server;

import eventsync.DirectExecutorService;
import eventsync.EventType;
import eventsync.InMemoryEventLog;
import eventsync.MutableClock;
import eventsync.RecordingChannel;
import eventsync.SyncEvent;
import eventsync.broadcast.ConnectionRegistry;
import eventsync.presence.InMemoryPresenceStore;
import eventsync.presence.PresenceTracker;
import eventsync.sequence.InMemorySequenceService;
import eventsync.spi.ClusterRelay;
import eventsync.store.RingBufferEventCache;
import eventsync.store.TieredEventStore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncSessionTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  private final InMemoryEventLog log = new InMemoryEventLog();
  private final InMemorySequenceService sequences = new InMemorySequenceService();
  private final TieredEventStore store = TieredEventStore.builder()
      .connectionProvider(InMemoryEventLog.connections())
      .eventLog(log)
      .eventCache(new RingBufferEventCache(100, Duration.ofHours(24), clock))
      .sequenceService(sequences)
      .clock(clock)
      .build();
  private final ConnectionRegistry registry = ConnectionRegistry.builder()
      .sender(new DirectExecutorService())
      .clock(clock)
      .build();
  private final PresenceTracker presence =
      new PresenceTracker(new InMemoryPresenceStore(), Duration.ofMinutes(5), clock);

  @AfterEach
  void tearDown() {
    registry.close();
  }

  @Test
  void syncReturnsEventsAfterCursor() throws Exception {
    for (int i = 0; i < 6; i++) {
      store.store(event("t1", EventType.LEAD_UPDATED, null));
    }
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);

    session.onMessage("{\"action\":\"sync\",\"lastEventId\":3}");

    JsonNode response = lastFrame(channel);
    assertEquals("sync_response", response.get("type").asText());
    assertEquals(List.of(4L, 5L, 6L), sequencesOf(response));
    assertFalse(response.get("hasMore").asBoolean());
    assertFalse(response.get("gap").asBoolean());
    assertEquals(6, response.get("lastSequenceNumber").asLong());
  }

  @Test
  void syncPagesThroughLongBacklog() throws Exception {
    for (int i = 0; i < 5; i++) {
      store.store(event("t1", EventType.CASE_CREATED, null));
    }
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 2);

    session.onMessage("{\"action\":\"sync\",\"lastEventId\":0}");
    JsonNode first = lastFrame(channel);
    session.onMessage("{\"action\":\"sync\",\"lastEventId\":" + first.get("lastSequenceNumber").asLong() + "}");
    JsonNode second = lastFrame(channel);

    assertTrue(first.get("hasMore").asBoolean());
    assertEquals(List.of(1L, 2L), sequencesOf(first));
    assertTrue(second.get("hasMore").asBoolean());
    assertEquals(List.of(3L, 4L), sequencesOf(second));
  }

  @Test
  void syncHidesOtherUsersPrivateEventsButAdvancesHead() throws Exception {
    store.store(event("t1", EventType.LEAD_CREATED, null));
    store.store(event("t1", EventType.PERMISSIONS_CHANGED, "u2"));
    store.store(event("t1", EventType.PERMISSIONS_CHANGED, "u1"));
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);

    session.onMessage("{\"action\":\"sync\",\"lastEventId\":0}");

    JsonNode response = lastFrame(channel);
    assertEquals(List.of(1L, 3L), sequencesOf(response));
    assertEquals(3, response.get("lastSequenceNumber").asLong());
  }

  @Test
  void syncReportsGapWhenCursorPredatesRetention() throws Exception {
    for (int i = 0; i < 10; i++) {
      log.append(null, event("t1", EventType.DOCUMENT_UPDATED, null));
    }
    for (long seq = 1; seq <= 5; seq++) {
      log.delete("t1", seq);
    }
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);

    session.onMessage("{\"action\":\"sync\",\"lastEventId\":2}");

    JsonNode response = lastFrame(channel);
    assertTrue(response.get("gap").asBoolean());
    assertEquals(0, response.get("events").size());
    assertEquals(10, response.get("lastSequenceNumber").asLong());
  }

  @Test
  void subscribeNarrowsLivePushes() {
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);

    session.onMessage("{\"action\":\"subscribe\",\"events\":[\"document_created\"]}");
    registry.broadcastEvent(event("t1", EventType.LEAD_CREATED, null));
    registry.broadcastEvent(event("t1", EventType.DOCUMENT_CREATED, null));

    assertEquals(1, channel.frames().size());
    assertTrue(channel.frames().get(0).contains("document_created"));
  }

  @Test
  void malformedFramesAreDroppedUntilLimit() {
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);

    for (int i = 0; i < 4; i++) {
      session.onMessage("{garbage");
    }
    assertTrue(channel.isOpen());
    assertTrue(channel.frames().isEmpty(), "no error frame is sent back");

    session.onMessage("{\"action\":\"explode\"}");

    assertFalse(channel.isOpen());
    assertEquals(0, registry.connectionCount());
  }

  @Test
  void anyFrameRefreshesLiveness() {
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);
    clock.advance(Duration.ofSeconds(80));

    session.onMessage("{\"type\":\"pong\",\"lastEventId\":0}");
    clock.advance(Duration.ofSeconds(20));

    assertEquals(0, registry.sweep(Duration.ofSeconds(90)));
    assertEquals(clock.instant().minusSeconds(20), session.connection().lastSeen());
  }

  @Test
  void presenceJoinSendsSnapshotAndAnnounces() throws Exception {
    var ada = new RecordingChannel();
    var bob = new RecordingChannel();
    SyncSession adaSession = open("t1", "u1", ada, 100);
    open("t1", "u2", bob, 100);

    adaSession.onMessage("{\"action\":\"viewing\",\"entityType\":\"lead\",\"entityId\":\"L1\",\"userName\":\"Ada\"}");

    List<String> types = typesOf(ada);
    assertEquals(List.of("initial_presence", "presence_joined"), types);
    assertEquals(List.of("presence_joined"), typesOf(bob));
    JsonNode snapshot = MAPPER.readTree(ada.frames().get(0));
    assertEquals("u1", snapshot.get("payload").get("users").get(0).get("userId").asText());
  }

  @Test
  void heartbeatIsSilentAndEditingIsAnnounced() throws Exception {
    var ada = new RecordingChannel();
    var bob = new RecordingChannel();
    SyncSession adaSession = open("t1", "u1", ada, 100);
    open("t1", "u2", bob, 100);
    adaSession.onMessage("{\"action\":\"viewing\",\"entityType\":\"lead\",\"entityId\":\"L1\"}");
    bob.clear();

    adaSession.onMessage("{\"action\":\"heartbeat\",\"entityType\":\"lead\",\"entityId\":\"L1\"}");
    assertTrue(bob.frames().isEmpty());

    adaSession.onMessage("{\"action\":\"editing\",\"entityType\":\"lead\",\"entityId\":\"L1\"}");
    assertEquals(List.of("presence_updated"), typesOf(bob));
  }

  @Test
  void closingSessionAnnouncesDeparture() throws Exception {
    var ada = new RecordingChannel();
    var bob = new RecordingChannel();
    SyncSession adaSession = open("t1", "u1", ada, 100);
    open("t1", "u2", bob, 100);
    adaSession.onMessage("{\"action\":\"viewing\",\"entityType\":\"case\",\"entityId\":\"C1\"}");
    bob.clear();

    adaSession.onClose();

    assertEquals(List.of("presence_left"), typesOf(bob));
    assertTrue(presence.getPresence("t1", "case", "C1").isEmpty());
    assertFalse(ada.isOpen());
  }

  @Test
  void presenceUsesAuthenticatedUserOverFrameUser() {
    var channel = new RecordingChannel();
    SyncSession session = open("t1", "u1", channel, 100);

    session.onMessage("{\"action\":\"viewing\",\"entityType\":\"lead\",\"entityId\":\"L1\",\"userId\":\"mallory\"}");

    assertEquals("u1", presence.getPresence("t1", "lead", "L1").get(0).userId());
  }

  private SyncSession open(String tenantId, String userId, RecordingChannel channel, int pageSize) {
    return new SyncSession(registry.register(tenantId, userId, channel), store, registry, presence,
        ClusterRelay.NOOP, null, pageSize, SyncSession.DEFAULT_MAX_MALFORMED);
  }

  private SyncEvent event(String tenantId, EventType type, String userId) {
    return SyncEvent.builder(type)
        .tenantId(tenantId)
        .sequenceNumber(sequences.nextSequence(tenantId))
        .userId(userId)
        .timestamp(clock.instant())
        .build();
  }

  private static JsonNode lastFrame(RecordingChannel channel) throws Exception {
    List<String> frames = channel.frames();
    return MAPPER.readTree(frames.get(frames.size() - 1));
  }

  private static List<Long> sequencesOf(JsonNode response) {
    List<Long> result = new ArrayList<>();
    for (JsonNode event : response.get("events")) {
      result.add(event.get("sequenceNumber").asLong());
    }
    return result;
  }

  private static List<String> typesOf(RecordingChannel channel) throws Exception {
    List<String> result = new ArrayList<>();
    for (String frame : channel.frames()) {
      result.add(MAPPER.readTree(frame).get("type").asText());
    }
    return result;
  }
}
