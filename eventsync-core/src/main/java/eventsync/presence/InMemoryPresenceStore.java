package eventsync.presence;

import eventsync.spi.PresenceStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link PresenceStore} kept in process memory.
 *
 * <p>Records are grouped per entity; each carries its own expiry. Expired records are invisible
 * to reads immediately and physically removed by {@link #sweep(Instant)}.
 */
public final class InMemoryPresenceStore implements PresenceStore {
  private final Map<PresenceKey, Map<String, Entry>> entities = new ConcurrentHashMap<>();

  @Override
  public PresenceState upsert(PresenceKey key, String userId, UnaryOperator<PresenceState> update,
      Duration ttl, Instant now) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(update, "update");
    PresenceState[] result = new PresenceState[1];
    entities.compute(key, (k, users) -> {
      Map<String, Entry> target = users != null ? users : new ConcurrentHashMap<>();
      Entry existing = target.get(userId);
      PresenceState current = existing == null || existing.isExpired(now) ? null : existing.state;
      result[0] = Objects.requireNonNull(update.apply(current), "update result");
      target.put(userId, new Entry(result[0], now.plus(ttl)));
      return target;
    });
    return result[0];
  }

  @Override
  public Optional<PresenceState> get(PresenceKey key, String userId, Instant now) {
    Map<String, Entry> users = entities.get(key);
    if (users == null) {
      return Optional.empty();
    }
    Entry entry = users.get(userId);
    if (entry == null || entry.isExpired(now)) {
      return Optional.empty();
    }
    return Optional.of(entry.state);
  }

  @Override
  public List<PresenceState> list(PresenceKey key, Instant now) {
    Map<String, Entry> users = entities.get(key);
    if (users == null) {
      return List.of();
    }
    List<PresenceState> result = new ArrayList<>(users.size());
    for (Entry entry : users.values()) {
      if (!entry.isExpired(now)) {
        result.add(entry.state);
      }
    }
    result.sort(Comparator.comparing(PresenceState::userId));
    return result;
  }

  @Override
  public boolean remove(PresenceKey key, String userId) {
    boolean[] removed = new boolean[1];
    entities.computeIfPresent(key, (k, users) -> {
      removed[0] = users.remove(userId) != null;
      return users.isEmpty() ? null : users;
    });
    return removed[0];
  }

  @Override
  public List<PresenceKey> removeAll(String tenantId, String userId) {
    List<PresenceKey> removed = new ArrayList<>();
    for (PresenceKey key : entities.keySet()) {
      if (key.tenantId().equals(tenantId) && remove(key, userId)) {
        removed.add(key);
      }
    }
    return removed;
  }

  @Override
  public int sweep(Instant now) {
    int[] swept = new int[1];
    for (PresenceKey key : entities.keySet()) {
      entities.computeIfPresent(key, (k, users) -> {
        int before = users.size();
        users.values().removeIf(entry -> entry.isExpired(now));
        swept[0] += before - users.size();
        return users.isEmpty() ? null : users;
      });
    }
    return swept[0];
  }

  private static final class Entry {
    private final PresenceState state;
    private final Instant expiresAt;

    Entry(PresenceState state, Instant expiresAt) {
      this.state = state;
      this.expiresAt = expiresAt;
    }

    boolean isExpired(Instant now) {
      return !expiresAt.isAfter(now);
    }
  }
}
