package eventsync.client;

/**
 * Reconnects after the same delay every time, optionally up to an attempt budget.
 */
public final class FixedDelayReconnectPolicy implements ReconnectPolicy {
  public static final long DEFAULT_DELAY_MS = 3000L;

  private final long delayMs;
  private final int maxAttempts;

  public FixedDelayReconnectPolicy() {
    this(DEFAULT_DELAY_MS, 0);
  }

  /**
   * @param delayMs     delay before every attempt (milliseconds)
   * @param maxAttempts attempts before giving up, {@code 0} for unlimited
   */
  public FixedDelayReconnectPolicy(long delayMs, int maxAttempts) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
    }
    this.delayMs = delayMs;
    this.maxAttempts = maxAttempts;
  }

  @Override
  public long computeDelayMs(int attempt) {
    return delayMs;
  }

  @Override
  public boolean shouldGiveUp(int attempt) {
    return maxAttempts > 0 && attempt > maxAttempts;
  }
}
