package eventsync.spi;

/**
 * Observability hook for exporting synchronization counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events emitted (sequence allocated and stored).
   */
  void incrementEmitted();

  /**
   * Increments the count of emissions that failed before reaching any client.
   */
  void incrementEmitFailure();

  /**
   * Increments the count of failed writes to the durable log or the cache.
   */
  void incrementStoreFailure();

  /**
   * Increments the count of frames written to client channels.
   */
  void incrementMessagesSent();

  /**
   * Increments the count of frames that could not be written (send failure or full queue).
   */
  void incrementSendFailure();

  /**
   * Increments the count of catch-up requests served.
   */
  void incrementCatchUpServed();

  /**
   * Increments the count of catch-up requests answered with a gap.
   */
  void incrementCatchUpGap();

  /**
   * Increments the count of reconnecting clients (sync requests with a non-zero cursor).
   */
  default void incrementReconnection() {
  }

  /**
   * Increments the count of malformed client messages dropped.
   */
  default void incrementMalformedMessage() {
  }

  /**
   * Records the number of open client connections in this process.
   *
   * @param count open connections
   */
  void recordConnectionCount(int count);

  /**
   * Records delivery latency: from event creation to the frame being written.
   *
   * @param latencyMs latency in milliseconds (always non-negative)
   */
  default void recordDeliveryLatencyMs(long latencyMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEmitted() {
    }

    @Override
    public void incrementEmitFailure() {
    }

    @Override
    public void incrementStoreFailure() {
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
    }

    @Override
    public void recordConnectionCount(int count) {
    }
  }
}
