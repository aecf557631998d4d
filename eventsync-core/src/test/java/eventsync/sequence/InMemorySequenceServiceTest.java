package eventsync.sequence;

import eventsync.EventType;
import eventsync.InMemoryEventLog;
import eventsync.SyncEvent;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySequenceServiceTest {

  @Test
  void startsAtOnePerTenant() {
    var service = new InMemorySequenceService();

    assertEquals(0, service.currentSequence("t1"));
    assertEquals(1, service.nextSequence("t1"));
    assertEquals(2, service.nextSequence("t1"));
    assertEquals(1, service.nextSequence("t2"));
    assertEquals(2, service.currentSequence("t1"));
  }

  @Test
  void resumesFromSeed() {
    var service = new InMemorySequenceService(tenantId -> tenantId.equals("t1") ? 41L : 0L);

    assertEquals(41, service.currentSequence("t1"));
    assertEquals(42, service.nextSequence("t1"));
    assertEquals(1, service.nextSequence("t2"));
  }

  @Test
  void seedIsReadOncePerTenant() {
    AtomicInteger seedReads = new AtomicInteger();
    var service = new InMemorySequenceService(tenantId -> {
      seedReads.incrementAndGet();
      return 10L;
    });

    assertEquals(10, service.currentSequence("t1"));
    assertEquals(10, service.currentSequence("t1"));
    assertEquals(11, service.nextSequence("t1"));
    assertEquals(11, service.currentSequence("t1"));

    assertEquals(1, seedReads.get());
  }

  @Test
  void seededFromNewestLoggedEvent() {
    var log = new InMemoryEventLog();
    for (long seq = 1; seq <= 7; seq++) {
      log.append(null, SyncEvent.builder(EventType.LEAD_CREATED).tenantId("t1").sequenceNumber(seq).build());
    }

    var service = InMemorySequenceService.seededFrom(InMemoryEventLog.connections(), log);

    assertEquals(8, service.nextSequence("t1"));
  }

  @Test
  void negativeSeedIsRejected() {
    var service = new InMemorySequenceService(tenantId -> -1L);

    assertThrows(IllegalStateException.class, () -> service.nextSequence("t1"));
  }

  @Test
  void concurrentAllocationsAreUnique() throws Exception {
    var service = new InMemorySequenceService();
    int threads = 8;
    int perThread = 250;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    Set<Long> seen = ConcurrentHashMap.newKeySet();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          for (int j = 0; j < perThread; j++) {
            seen.add(service.nextSequence("t1"));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(threads * perThread, seen.size());
    assertEquals(threads * perThread, service.currentSequence("t1"));
  }
}
