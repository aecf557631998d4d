package eventsync.micrometer;

import eventsync.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventsync.events.emitted} - events allocated and stored</li>
 *   <li>{@code eventsync.events.emit.failure} - emissions that failed before any delivery</li>
 *   <li>{@code eventsync.store.failure} - failed writes to the durable log or cache</li>
 *   <li>{@code eventsync.messages.sent} - frames written to client channels</li>
 *   <li>{@code eventsync.messages.send.failure} - frames not written (I/O error or full queue)</li>
 *   <li>{@code eventsync.catchup.served} - catch-up requests served</li>
 *   <li>{@code eventsync.catchup.gap} - catch-up requests answered with a gap</li>
 *   <li>{@code eventsync.reconnections} - sync requests with a non-zero cursor</li>
 *   <li>{@code eventsync.messages.malformed} - malformed client frames dropped</li>
 * </ul>
 *
 * <h3>Gauges and summaries</h3>
 * <ul>
 *   <li>{@code eventsync.connections} - open client connections in this process</li>
 *   <li>{@code eventsync.delivery.latency.ms} - event creation to frame write</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter emitted;
  private final Counter emitFailure;
  private final Counter storeFailure;
  private final Counter messagesSent;
  private final Counter sendFailure;
  private final Counter catchUpServed;
  private final Counter catchUpGap;
  private final Counter reconnections;
  private final Counter malformed;
  private final Gauge connectionsGauge;
  private final DistributionSummary deliveryLatency;

  private final AtomicInteger connections = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventsync"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventsync");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "crm.sync"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.emitted = counter(namePrefix + ".events.emitted", "Events allocated and stored");
    this.emitFailure = counter(namePrefix + ".events.emit.failure", "Emissions that failed before delivery");
    this.storeFailure = counter(namePrefix + ".store.failure", "Failed writes to the log or cache");
    this.messagesSent = counter(namePrefix + ".messages.sent", "Frames written to client channels");
    this.sendFailure = counter(namePrefix + ".messages.send.failure", "Frames that could not be written");
    this.catchUpServed = counter(namePrefix + ".catchup.served", "Catch-up requests served");
    this.catchUpGap = counter(namePrefix + ".catchup.gap", "Catch-up requests answered with a gap");
    this.reconnections = counter(namePrefix + ".reconnections", "Sync requests with a non-zero cursor");
    this.malformed = counter(namePrefix + ".messages.malformed", "Malformed client frames dropped");

    this.connectionsGauge = Gauge.builder(namePrefix + ".connections", connections, AtomicInteger::get)
        .description("Open client connections")
        .register(registry);
    this.deliveryLatency = DistributionSummary.builder(namePrefix + ".delivery.latency.ms")
        .description("Event creation to frame write in milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEmitted() {
    if (closed) return;
    emitted.increment();
  }

  @Override
  public void incrementEmitFailure() {
    if (closed) return;
    emitFailure.increment();
  }

  @Override
  public void incrementStoreFailure() {
    if (closed) return;
    storeFailure.increment();
  }

  @Override
  public void incrementMessagesSent() {
    if (closed) return;
    messagesSent.increment();
  }

  @Override
  public void incrementSendFailure() {
    if (closed) return;
    sendFailure.increment();
  }

  @Override
  public void incrementCatchUpServed() {
    if (closed) return;
    catchUpServed.increment();
  }

  @Override
  public void incrementCatchUpGap() {
    if (closed) return;
    catchUpGap.increment();
  }

  @Override
  public void incrementReconnection() {
    if (closed) return;
    reconnections.increment();
  }

  @Override
  public void incrementMalformedMessage() {
    if (closed) return;
    malformed.increment();
  }

  @Override
  public void recordConnectionCount(int count) {
    if (closed) return;
    connections.set(count);
  }

  @Override
  public void recordDeliveryLatencyMs(long latencyMs) {
    if (closed) return;
    deliveryLatency.record(latencyMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link eventsync.EventSync} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(emitted, emitFailure, storeFailure, messagesSent, sendFailure,
        catchUpServed, catchUpGap, reconnections, malformed, connectionsGauge, deliveryLatency)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
