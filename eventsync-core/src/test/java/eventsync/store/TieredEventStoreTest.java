package eventsync.store;

import eventsync.EventType;
import eventsync.InMemoryEventLog;
import eventsync.MutableClock;
import eventsync.SyncEvent;
import eventsync.sequence.InMemorySequenceService;
import eventsync.spi.EventCache;
import eventsync.spi.MetricsExporter;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TieredEventStoreTest {
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final MutableClock clock = new MutableClock(T0);
  private final InMemoryEventLog log = new InMemoryEventLog();
  private final InMemorySequenceService sequences = new InMemorySequenceService();
  private final CountingMetrics metrics = new CountingMetrics();

  @Test
  void builderRequiresLogAndSequences() {
    assertThrows(NullPointerException.class, () -> TieredEventStore.builder()
        .connectionProvider(InMemoryEventLog.connections())
        .sequenceService(sequences)
        .build());
    assertThrows(NullPointerException.class, () -> TieredEventStore.builder()
        .connectionProvider(InMemoryEventLog.connections())
        .eventLog(log)
        .build());
  }

  @Test
  void rejectsNegativeCursorAndEmptyPage() {
    TieredEventStore store = newStore(cache());

    assertThrows(IllegalArgumentException.class, () -> store.getEventsSince("t1", -1, 10));
    assertThrows(IllegalArgumentException.class, () -> store.getEventsSince("t1", 0, 0));
  }

  @Test
  void catchUpFromCacheReturnsEverythingAfterCursor() {
    TieredEventStore store = newStore(cache());
    emit(store, "t1", 10);

    CatchUpResult result = store.getEventsSince("t1", 4, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertEquals(List.of(5L, 6L, 7L, 8L, 9L, 10L), sequences(result.events()));
    assertEquals(10, result.headSequence());
    assertEquals(0, log.reads(), "served without touching the log");
  }

  @Test
  void catchUpFromLogWhenCacheIsCold() {
    emit(newStore(cache()), "t1", 10);
    TieredEventStore restarted = newStore(cache());

    CatchUpResult result = restarted.getEventsSince("t1", 4, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertEquals(List.of(5L, 6L, 7L, 8L, 9L, 10L), sequences(result.events()));
    assertEquals(1, log.reads());
  }

  @Test
  void cacheHoleFallsBackToLog() {
    RingBufferEventCache cache = cache();
    TieredEventStore store = newStore(cache);
    emit(store, "t1", 5);
    log.append(null, event("t1", sequences.nextSequence("t1")));
    emit(store, "t1", 4);

    CatchUpResult result = store.getEventsSince("t1", 4, 100);

    assertEquals(List.of(5L, 6L, 7L, 8L, 9L, 10L), sequences(result.events()));
    assertEquals(1, log.reads());
  }

  @Test
  void pageStopsBeforeSequenceCommittedOutOfOrder() {
    TieredEventStore store = newStore(cache());
    emit(store, "t1", 4);
    SyncEvent fifth = event("t1", sequences.nextSequence("t1"));
    SyncEvent sixth = event("t1", sequences.nextSequence("t1"));
    store.store(sixth);

    CatchUpResult waiting = store.getEventsSince("t1", 4, 100);
    CatchUpResult fromStart = store.getEventsSince("t1", 2, 100);

    assertEquals(CatchUpResult.Status.PARTIAL, waiting.status());
    assertTrue(waiting.events().isEmpty());
    assertEquals(4, waiting.headSequence());
    assertEquals(CatchUpResult.Status.PARTIAL, fromStart.status());
    assertEquals(List.of(3L, 4L), sequences(fromStart.events()));

    store.store(fifth);
    CatchUpResult complete = store.getEventsSince("t1", 4, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, complete.status());
    assertEquals(List.of(5L, 6L), sequences(complete.events()));
  }

  @Test
  void sequenceNeverStoredIsSkippedAfterHoleTimeout() {
    TieredEventStore store = newStore(cache());
    emit(store, "t1", 4);
    sequences.nextSequence("t1");
    store.store(event("t1", sequences.nextSequence("t1")));

    assertEquals(CatchUpResult.Status.PARTIAL, store.getEventsSince("t1", 4, 100).status());

    clock.advance(TieredEventStore.DEFAULT_HOLE_TIMEOUT.plusSeconds(1));
    CatchUpResult result = store.getEventsSince("t1", 4, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertEquals(List.of(6L), sequences(result.events()));
    assertEquals(6, result.headSequence());
  }

  @Test
  void expiredRowsAreHiddenBeforeTheyArePurged() {
    TieredEventStore writer = newStore(cache());
    for (int i = 0; i < 3; i++) {
      writer.store(event("t1", sequences.nextSequence("t1"), Duration.ofMinutes(10)));
    }
    emit(writer, "t1", 2);
    clock.advance(Duration.ofHours(1));
    TieredEventStore store = newStore(cache());

    CatchUpResult fresh = store.getEventsSince("t1", 0, 100);
    CatchUpResult behind = store.getEventsSince("t1", 1, 100);
    CatchUpResult current = store.getEventsSince("t1", 3, 100);

    assertEquals(List.of(4L, 5L), sequences(fresh.events()));
    assertEquals(CatchUpResult.Status.GAP, behind.status());
    assertEquals(CatchUpResult.Status.COMPLETE, current.status());
    assertEquals(List.of(4L, 5L), sequences(current.events()));
    assertEquals(5, log.events("t1").size(), "nothing purged yet");
  }

  @Test
  void pageLimitMarksResultPartial() {
    TieredEventStore store = newStore(cache());
    emit(store, "t1", 10);

    CatchUpResult cached = store.getEventsSince("t1", 4, 3);
    CatchUpResult logged = newStore(cache()).getEventsSince("t1", 4, 3);

    for (CatchUpResult result : List.of(cached, logged)) {
      assertEquals(CatchUpResult.Status.PARTIAL, result.status());
      assertTrue(result.hasMore());
      assertEquals(List.of(5L, 6L, 7L), sequences(result.events()));
      assertEquals(7, result.headSequence());
    }
  }

  @Test
  void cursorAtHeadReturnsNothing() {
    TieredEventStore store = newStore(cache());
    emit(store, "t1", 3);

    CatchUpResult result = store.getEventsSince("t1", 3, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertTrue(result.events().isEmpty());
    assertEquals(3, result.headSequence());
  }

  @Test
  void purgedPrefixIsReportedAsGap() {
    emit(newStore(cache()), "t1", 10);
    for (long seq = 1; seq <= 5; seq++) {
      log.delete("t1", seq);
    }
    TieredEventStore store = newStore(cache());

    CatchUpResult result = store.getEventsSince("t1", 2, 100);

    assertEquals(CatchUpResult.Status.GAP, result.status());
    assertTrue(result.events().isEmpty());
    assertEquals(10, result.headSequence());
    assertEquals(1, metrics.gaps.get());
  }

  @Test
  void cursorJustBeforeRetainedRangeIsNotAGap() {
    emit(newStore(cache()), "t1", 10);
    for (long seq = 1; seq <= 5; seq++) {
      log.delete("t1", seq);
    }

    CatchUpResult result = newStore(cache()).getEventsSince("t1", 5, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertEquals(List.of(6L, 7L, 8L, 9L, 10L), sequences(result.events()));
  }

  @Test
  void freshClientNeverGetsAGap() {
    emit(newStore(cache()), "t1", 10);
    for (long seq = 1; seq <= 5; seq++) {
      log.delete("t1", seq);
    }

    CatchUpResult result = newStore(cache()).getEventsSince("t1", 0, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertEquals(6, result.events().get(0).sequenceNumber());
  }

  @Test
  void fullyPurgedLogIsAGapWhenSequenceMovedOn() {
    emit(newStore(cache()), "t1", 10);
    for (long seq = 1; seq <= 10; seq++) {
      log.delete("t1", seq);
    }
    TieredEventStore store = newStore(cache());

    CatchUpResult behind = store.getEventsSince("t1", 3, 100);
    CatchUpResult current = store.getEventsSince("t1", 10, 100);

    assertEquals(CatchUpResult.Status.GAP, behind.status());
    assertEquals(10, behind.headSequence());
    assertEquals(CatchUpResult.Status.COMPLETE, current.status());
    assertTrue(current.events().isEmpty());
  }

  @Test
  void logFailureWithColdCacheIsUnavailable() {
    emit(newStore(cache()), "t1", 5);
    TieredEventStore store = newStore(cache());
    log.failing(true);

    CatchUpResult result = store.getEventsSince("t1", 2, 100);

    assertEquals(CatchUpResult.Status.UNAVAILABLE, result.status());
    assertEquals(2, result.headSequence());
    assertTrue(metrics.storeFailures.get() > 0);
  }

  @Test
  void logFailureWithWarmCacheStillServes() {
    TieredEventStore store = newStore(cache());
    emit(store, "t1", 5);
    log.failing(true);

    CatchUpResult result = store.getEventsSince("t1", 2, 100);

    assertEquals(CatchUpResult.Status.COMPLETE, result.status());
    assertEquals(List.of(3L, 4L, 5L), sequences(result.events()));
  }

  @Test
  void storeKeepsEventInCacheWhenLogFails() {
    RingBufferEventCache cache = cache();
    TieredEventStore store = newStore(cache);
    log.failing(true);

    boolean stored = store.store(event("t1", 1));

    assertFalse(stored);
    assertEquals(1, cache.size("t1"));
    assertEquals(1, metrics.storeFailures.get());
  }

  @Test
  void cacheFailureFallsBackToLog() {
    EventCache broken = new EventCache() {
      @Override
      public void push(SyncEvent event) {
        throw new IllegalStateException("cache down");
      }

      @Override
      public List<SyncEvent> window(String tenantId, Instant now) {
        throw new IllegalStateException("cache down");
      }

      @Override
      public int evictExpired(Instant now) {
        return 0;
      }
    };
    TieredEventStore store = newStore(broken);

    assertFalse(store.store(event("t1", 1)));
    CatchUpResult result = store.getEventsSince("t1", 0, 10);

    assertEquals(List.of(1L), sequences(result.events()));
  }

  @Test
  void purgeRemovesExpiredEventsInBatches() {
    RingBufferEventCache cache = cache();
    TieredEventStore store = TieredEventStore.builder()
        .connectionProvider(InMemoryEventLog.connections())
        .eventLog(log)
        .eventCache(cache)
        .purger(log)
        .sequenceService(sequences)
        .clock(clock)
        .purgeBatchSize(2)
        .build();
    for (int i = 0; i < 5; i++) {
      store.store(event("t1", sequences.nextSequence("t1"), Duration.ofMinutes(10)));
    }
    store.store(event("t1", sequences.nextSequence("t1"), Duration.ofHours(24)));

    clock.advance(Duration.ofHours(1));
    long removed = store.purgeExpired();

    assertEquals(10, removed, "five rows from the log and five from the cache");
    assertEquals(List.of(6L), sequences(log.events("t1")));
    assertEquals(1, cache.size("t1"));
  }

  @Test
  void purgeWithoutPurgerOnlyEvictsCache() {
    TieredEventStore store = newStore(cache());
    store.store(event("t1", sequences.nextSequence("t1"), Duration.ofMinutes(10)));

    clock.advance(Duration.ofHours(1));

    assertEquals(1, store.purgeExpired());
    assertEquals(1, log.events("t1").size());
  }

  private TieredEventStore newStore(EventCache cache) {
    return TieredEventStore.builder()
        .connectionProvider(InMemoryEventLog.connections())
        .eventLog(log)
        .eventCache(cache)
        .sequenceService(sequences)
        .metrics(metrics)
        .clock(clock)
        .build();
  }

  private RingBufferEventCache cache() {
    return new RingBufferEventCache(100, Duration.ofHours(24), clock);
  }

  private void emit(TieredEventStore store, String tenantId, int count) {
    for (int i = 0; i < count; i++) {
      assertTrue(store.store(event(tenantId, sequences.nextSequence(tenantId))));
    }
  }

  private SyncEvent event(String tenantId, long seq) {
    return event(tenantId, seq, Duration.ofHours(24));
  }

  private SyncEvent event(String tenantId, long seq, Duration retention) {
    return SyncEvent.builder(EventType.CASE_UPDATED)
        .tenantId(tenantId)
        .sequenceNumber(seq)
        .payloadJson("{\"caseId\":\"C" + seq + "\"}")
        .timestamp(clock.instant())
        .expiresAt(clock.instant().plus(retention))
        .build();
  }

  private static List<Long> sequences(List<SyncEvent> events) {
    return events.stream().map(SyncEvent::sequenceNumber).collect(Collectors.toList());
  }

  private static final class CountingMetrics implements MetricsExporter {
    final AtomicInteger storeFailures = new AtomicInteger();
    final AtomicInteger gaps = new AtomicInteger();

    @Override
    public void incrementEmitted() {
    }

    @Override
    public void incrementEmitFailure() {
    }

    @Override
    public void incrementStoreFailure() {
      storeFailures.incrementAndGet();
    }

    @Override
    public void incrementMessagesSent() {
    }

    @Override
    public void incrementSendFailure() {
    }

    @Override
    public void incrementCatchUpServed() {
    }

    @Override
    public void incrementCatchUpGap() {
      gaps.incrementAndGet();
    }

    @Override
    public void recordConnectionCount(int count) {
    }
  }
}
