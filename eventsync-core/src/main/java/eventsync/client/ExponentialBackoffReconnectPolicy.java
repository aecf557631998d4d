package eventsync.client;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect policy using capped exponential backoff with jitter and an attempt budget.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay},
 * with random jitter in the range [0.5, 1.5).
 */
public final class ExponentialBackoffReconnectPolicy implements ReconnectPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final int maxAttempts;

  /**
   * @param baseDelayMs delay before the first reconnect (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param maxAttempts attempts before giving up, {@code 0} for unlimited
   */
  public ExponentialBackoffReconnectPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.maxAttempts = maxAttempts;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempt >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempt - 1);
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    long withJitter = (long) (capped * jitter);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  @Override
  public boolean shouldGiveUp(int attempt) {
    return maxAttempts > 0 && attempt > maxAttempts;
  }
}
