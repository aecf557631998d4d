package eventsync.broadcast;

import eventsync.EventType;
import eventsync.SyncEvent;
import eventsync.presence.PresenceAction;
import eventsync.presence.PresenceChange;
import eventsync.presence.PresenceState;
import eventsync.spi.ClusterRelay;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryClusterRelayTest {

  @Test
  void publishReachesOtherNodesOnly() {
    var cluster = new InMemoryClusterRelay();
    ClusterRelay a = cluster.join();
    ClusterRelay b = cluster.join();
    ClusterRelay c = cluster.join();
    List<SyncEvent> seenByA = new CopyOnWriteArrayList<>();
    List<SyncEvent> seenByB = new CopyOnWriteArrayList<>();
    List<SyncEvent> seenByC = new CopyOnWriteArrayList<>();
    a.subscribe(seenByA::add);
    b.subscribe(seenByB::add);
    c.subscribe(seenByC::add);

    SyncEvent event = SyncEvent.builder(EventType.LEAD_CREATED).tenantId("t1").sequenceNumber(1).build();
    a.publish(event);

    assertTrue(seenByA.isEmpty());
    assertEquals(List.of(event), seenByB);
    assertEquals(List.of(event), seenByC);
  }

  @Test
  void failingSubscriberDoesNotStopDelivery() {
    var cluster = new InMemoryClusterRelay();
    ClusterRelay a = cluster.join();
    ClusterRelay b = cluster.join();
    List<SyncEvent> seen = new CopyOnWriteArrayList<>();
    b.subscribe(event -> {
      throw new IllegalStateException("boom");
    });
    b.subscribe(seen::add);

    a.publish(SyncEvent.builder(EventType.CASE_DELETED).tenantId("t1").sequenceNumber(1).build());

    assertEquals(1, seen.size());
  }

  @Test
  void presenceChangesReachOtherNodesWithTheirTenant() {
    var cluster = new InMemoryClusterRelay();
    ClusterRelay a = cluster.join();
    ClusterRelay b = cluster.join();
    List<String> seenByA = new CopyOnWriteArrayList<>();
    List<String> seenByB = new CopyOnWriteArrayList<>();
    a.subscribePresence((tenantId, change) -> seenByA.add(tenantId + ":" + change.state().userId()));
    b.subscribePresence((tenantId, change) -> seenByB.add(tenantId + ":" + change.state().userId()));

    PresenceState state = new PresenceState("u1", "Ada", "lead", "L1", PresenceAction.VIEWING, Instant.EPOCH);
    a.publishPresence("t1", new PresenceChange(PresenceChange.Kind.JOINED, state));

    assertTrue(seenByA.isEmpty());
    assertEquals(List.of("t1:u1"), seenByB);
  }
}
