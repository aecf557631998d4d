package eventsync.server;

import eventsync.Await;
import eventsync.DirectExecutorService;
import eventsync.MutableClock;
import eventsync.RecordingChannel;
import eventsync.broadcast.ClientConnection;
import eventsync.broadcast.ConnectionRegistry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class KeepAliveSchedulerTest {
  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  private final ConnectionRegistry registry = ConnectionRegistry.builder()
      .sender(new DirectExecutorService())
      .clock(clock)
      .build();

  @AfterEach
  void tearDown() {
    registry.close();
  }

  @Test
  void idleTimeoutMustExceedPingInterval() {
    assertThrows(IllegalArgumentException.class, () -> KeepAliveScheduler.builder()
        .registry(registry)
        .pingInterval(Duration.ofSeconds(30))
        .idleTimeout(Duration.ofSeconds(30))
        .build());
    assertThrows(NullPointerException.class, () -> KeepAliveScheduler.builder().build());
  }

  @Test
  void runOncePingsEveryConnection() {
    var a = new RecordingChannel();
    var b = new RecordingChannel();
    registry.register("t1", "u1", a);
    registry.register("t2", "u2", b);
    KeepAliveScheduler keepAlive = KeepAliveScheduler.builder().registry(registry).build();

    assertEquals(2, keepAlive.runOnce());
    assertEquals(1, a.framesContaining("\"type\":\"ping\"").size());
    assertEquals(1, b.framesContaining("\"type\":\"ping\"").size());
  }

  @Test
  void runOnceClosesSilentConnectionsBeforePinging() {
    var silent = new RecordingChannel();
    var chatty = new RecordingChannel();
    registry.register("t1", "u1", silent);
    ClientConnection chattyConnection = registry.register("t1", "u2", chatty);
    KeepAliveScheduler keepAlive = KeepAliveScheduler.builder()
        .registry(registry)
        .pingInterval(Duration.ofSeconds(30))
        .idleTimeout(Duration.ofSeconds(90))
        .build();

    clock.advance(Duration.ofSeconds(60));
    chattyConnection.touch();
    clock.advance(Duration.ofSeconds(31));

    assertEquals(1, keepAlive.runOnce());
    assertFalse(silent.isOpen());
    assertTrue(silent.frames().isEmpty());
    assertEquals(1, chatty.frames().size());
  }

  @Test
  void scheduledPingsArrive() {
    var channel = new RecordingChannel();
    registry.register("t1", "u1", channel);
    KeepAliveScheduler keepAlive = KeepAliveScheduler.builder()
        .registry(registry)
        .pingInterval(Duration.ofMillis(20))
        .idleTimeout(Duration.ofMinutes(1))
        .build();

    keepAlive.start();
    try {
      Await.until(() -> channel.frames().size() >= 2);
    } finally {
      keepAlive.close();
    }
    assertThrows(IllegalStateException.class, keepAlive::start);
    assertEquals(0, keepAlive.runOnce());
  }
}
