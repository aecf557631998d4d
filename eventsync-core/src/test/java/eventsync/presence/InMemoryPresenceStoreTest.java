package eventsync.presence;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPresenceStoreTest {
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Duration TTL = Duration.ofMinutes(5);

  private final InMemoryPresenceStore store = new InMemoryPresenceStore();
  private final PresenceKey lead = new PresenceKey("t1", "lead", "L1");

  @Test
  void upsertSeesPreviousLiveState() {
    store.upsert(lead, "u1", current -> state("u1", PresenceAction.VIEWING), TTL, T0);

    PresenceState[] seen = new PresenceState[1];
    store.upsert(lead, "u1", current -> {
      seen[0] = current;
      return state("u1", PresenceAction.EDITING);
    }, TTL, T0.plusSeconds(10));

    assertEquals(PresenceAction.VIEWING, seen[0].action());
    assertEquals(PresenceAction.EDITING, store.get(lead, "u1", T0.plusSeconds(10)).orElseThrow().action());
  }

  @Test
  void expiredStateLooksAbsent() {
    store.upsert(lead, "u1", current -> state("u1", PresenceAction.VIEWING), TTL, T0);

    PresenceState[] seen = new PresenceState[]{state("x", PresenceAction.IDLE)};
    store.upsert(lead, "u1", current -> {
      seen[0] = current;
      return state("u1", PresenceAction.VIEWING);
    }, TTL, T0.plus(TTL));

    assertNull(seen[0]);
  }

  @Test
  void removeAllCoversEveryEntityOfTheTenant() {
    PresenceKey doc = new PresenceKey("t1", "document", "D1");
    PresenceKey otherTenant = new PresenceKey("t2", "lead", "L1");
    store.upsert(lead, "u1", current -> state("u1", PresenceAction.VIEWING), TTL, T0);
    store.upsert(doc, "u1", current -> state("u1", PresenceAction.VIEWING), TTL, T0);
    store.upsert(otherTenant, "u1", current -> state("u1", PresenceAction.VIEWING), TTL, T0);

    assertEquals(2, store.removeAll("t1", "u1").size());
    assertTrue(store.list(lead, T0).isEmpty());
    assertEquals(1, store.list(otherTenant, T0).size());
  }

  @Test
  void sweepDropsExpiredEntries() {
    store.upsert(lead, "u1", current -> state("u1", PresenceAction.VIEWING), TTL, T0);
    store.upsert(lead, "u2", current -> state("u2", PresenceAction.VIEWING), TTL, T0.plusSeconds(120));

    assertEquals(1, store.sweep(T0.plus(TTL)));
    assertEquals(1, store.list(lead, T0.plus(TTL)).size());
    assertFalse(store.remove(lead, "u1"));
    assertTrue(store.remove(lead, "u2"));
  }

  private static PresenceState state(String userId, PresenceAction action) {
    return new PresenceState(userId, null, "lead", "L1", action, T0);
  }
}
