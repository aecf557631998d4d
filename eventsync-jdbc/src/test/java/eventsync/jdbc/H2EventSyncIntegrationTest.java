package eventsync.jdbc;

import eventsync.EventSync;
import eventsync.EventType;
import eventsync.SyncEvent;
import eventsync.jdbc.log.H2EventLog;
import eventsync.jdbc.purge.H2EventPurger;
import eventsync.jdbc.sequence.JdbcSequenceService;
import eventsync.spi.ConnectionProvider;
import eventsync.store.CatchUpResult;
import eventsync.store.TieredEventStore;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class H2EventSyncIntegrationTest {
  private JdbcDataSource dataSource;
  private ConnectionProvider connectionProvider;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = Schemas.h2();
    connectionProvider = dataSource::getConnection;
  }

  @Test
  void sequenceContinuesAcrossRestartWithSharedCounter() {
    try (EventSync first = sharedCounterSync(SyncEvent.DEFAULT_RETENTION)) {
      for (int i = 0; i < 3; i++) {
        first.emitter().emitLeadUpdated("t1", Map.of("leadId", "L" + i));
      }
    }

    try (EventSync second = sharedCounterSync(SyncEvent.DEFAULT_RETENTION)) {
      SyncEvent next = second.emitter().emitLeadDeleted("t1", "L0").orElseThrow();
      assertEquals(4, next.sequenceNumber());

      CatchUpResult all = second.store().getEventsSince("t1", 0, 100);
      assertEquals(CatchUpResult.Status.COMPLETE, all.status());
      assertEquals(List.of(1L, 2L, 3L, 4L), sequences(all.events()));
      assertEquals(EventType.LEAD_DELETED, all.events().get(3).eventType());
    }
  }

  @Test
  void singleNodeSeedsFromLogAfterRestart() {
    try (EventSync first = EventSync.singleNode()
        .connectionProvider(connectionProvider)
        .eventLog(new H2EventLog())
        .build()) {
      first.emitter().emitCaseCreated("t1", Map.of("caseId", "C1"));
      first.emitter().emitCaseUpdated("t1", Map.of("caseId", "C1"));
    }

    try (EventSync second = EventSync.singleNode()
        .connectionProvider(connectionProvider)
        .eventLog(new H2EventLog())
        .build()) {
      assertEquals(3, second.emitter().emitCaseDeleted("t1", "C1").orElseThrow().sequenceNumber());
      assertEquals(1, second.emitter().emitCaseCreated("t2", Map.of("caseId", "C9")).orElseThrow().sequenceNumber());
    }
  }

  @Test
  void pagesComeFromDurableLogWhenCacheIsCold() {
    try (EventSync first = sharedCounterSync(SyncEvent.DEFAULT_RETENTION)) {
      for (int i = 0; i < 5; i++) {
        first.emitter().emitDocumentCreated("t1", Map.of("documentId", "D" + i));
      }
    }

    try (EventSync second = sharedCounterSync(SyncEvent.DEFAULT_RETENTION)) {
      CatchUpResult page = second.store().getEventsSince("t1", 1, 2);

      assertTrue(page.hasMore());
      assertEquals(List.of(2L, 3L), sequences(page.events()));
      assertEquals(List.of(4L, 5L), sequences(second.store().getEventsSince("t1", 3, 2).events()));
    }
  }

  @Test
  void purgedHistoryTurnsCursorIntoGap() throws Exception {
    try (EventSync sync = sharedCounterSync(Duration.ofMillis(100))) {
      for (int i = 0; i < 3; i++) {
        sync.emitter().emitLeadCreated("t1", Map.of("leadId", "L" + i));
      }
      Thread.sleep(250);

      assertEquals(6, sync.purgeScheduler().runOnce());

      CatchUpResult result = sync.store().getEventsSince("t1", 1, 100);
      assertTrue(result.isGap());
      assertEquals(3, result.headSequence());
      assertEquals(CatchUpResult.Status.COMPLETE, sync.store().getEventsSince("t1", 3, 100).status());
    }
  }

  @Test
  void catchUpWaitsForSequenceAnotherNodeCommitsLater() {
    JdbcSequenceService nodeA = new JdbcSequenceService(connectionProvider);
    JdbcSequenceService nodeB = new JdbcSequenceService(connectionProvider);
    TieredEventStore storeA = nodeStore(nodeA);
    TieredEventStore storeB = nodeStore(nodeB);
    for (int i = 0; i < 4; i++) {
      assertTrue(storeA.store(leadEvent(nodeA.nextSequence("t1"))));
    }
    SyncEvent fifth = leadEvent(nodeA.nextSequence("t1"));
    SyncEvent sixth = leadEvent(nodeB.nextSequence("t1"));
    assertEquals(6, sixth.sequenceNumber());
    assertTrue(storeB.store(sixth));

    TieredEventStore reader = nodeStore(nodeB);
    CatchUpResult waiting = reader.getEventsSince("t1", 4, 100);

    assertEquals(CatchUpResult.Status.PARTIAL, waiting.status());
    assertTrue(waiting.events().isEmpty());
    assertEquals(4, waiting.headSequence());

    assertTrue(storeA.store(fifth));
    CatchUpResult complete = reader.getEventsSince("t1", 4, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, complete.status());
    assertEquals(List.of(5L, 6L), sequences(complete.events()));
  }

  private TieredEventStore nodeStore(JdbcSequenceService sequences) {
    return TieredEventStore.builder()
        .connectionProvider(connectionProvider)
        .eventLog(new H2EventLog())
        .sequenceService(sequences)
        .build();
  }

  private static SyncEvent leadEvent(long seq) {
    return SyncEvent.builder(EventType.LEAD_UPDATED)
        .tenantId("t1")
        .sequenceNumber(seq)
        .payloadJson("{\"leadId\":\"L" + seq + "\"}")
        .build();
  }

  private EventSync sharedCounterSync(Duration retention) {
    return EventSync.singleNode()
        .connectionProvider(connectionProvider)
        .eventLog(new H2EventLog())
        .purger(new H2EventPurger())
        .sequenceService(new JdbcSequenceService(connectionProvider))
        .retention(retention)
        .build();
  }

  private static List<Long> sequences(List<SyncEvent> events) {
    return events.stream().map(SyncEvent::sequenceNumber).collect(Collectors.toList());
  }
}
