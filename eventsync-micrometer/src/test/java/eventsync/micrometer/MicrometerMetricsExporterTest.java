package eventsync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementEmitted() {
    exporter.incrementEmitted();
    exporter.incrementEmitted();
    assertEquals(2.0, counter("eventsync.events.emitted").count());
  }

  @Test
  void failureCounters() {
    exporter.incrementEmitFailure();
    exporter.incrementStoreFailure();
    exporter.incrementStoreFailure();
    exporter.incrementSendFailure();
    assertEquals(1.0, counter("eventsync.events.emit.failure").count());
    assertEquals(2.0, counter("eventsync.store.failure").count());
    assertEquals(1.0, counter("eventsync.messages.send.failure").count());
  }

  @Test
  void catchUpCounters() {
    exporter.incrementCatchUpServed();
    exporter.incrementCatchUpServed();
    exporter.incrementCatchUpGap();
    exporter.incrementReconnection();
    assertEquals(2.0, counter("eventsync.catchup.served").count());
    assertEquals(1.0, counter("eventsync.catchup.gap").count());
    assertEquals(1.0, counter("eventsync.reconnections").count());
  }

  @Test
  void messageCounters() {
    exporter.incrementMessagesSent();
    exporter.incrementMalformedMessage();
    assertEquals(1.0, counter("eventsync.messages.sent").count());
    assertEquals(1.0, counter("eventsync.messages.malformed").count());
  }

  @Test
  void recordConnectionCount() {
    exporter.recordConnectionCount(12);
    assertEquals(12.0, gauge("eventsync.connections").value());

    exporter.recordConnectionCount(0);
    assertEquals(0.0, gauge("eventsync.connections").value());
  }

  @Test
  void recordDeliveryLatency() {
    exporter.recordDeliveryLatencyMs(40);
    exporter.recordDeliveryLatencyMs(60);
    DistributionSummary summary = registry.find("eventsync.delivery.latency.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(100.0, summary.totalAmount());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "crm.sync");
    custom.incrementEmitted();
    custom.recordConnectionCount(3);

    assertEquals(1.0, counter("crm.sync.events.emitted").count());
    assertEquals(3.0, gauge("crm.sync.connections").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementEmitted();
    exporter.close();

    assertNull(registry.find("eventsync.events.emitted").counter());
    assertNull(registry.find("eventsync.connections").gauge());
    exporter.incrementEmitted();
    exporter.recordConnectionCount(5);
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "crm."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
