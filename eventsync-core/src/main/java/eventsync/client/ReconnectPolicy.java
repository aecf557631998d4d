package eventsync.client;

/**
 * Strategy for spacing reconnect attempts of a {@link SyncClient}.
 *
 * @see ExponentialBackoffReconnectPolicy
 * @see FixedDelayReconnectPolicy
 */
public interface ReconnectPolicy {

  /**
   * Computes the delay before the given reconnect attempt.
   *
   * @param attempt reconnect attempts since the client was last live (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempt);

  /**
   * Returns {@code true} if the client should stop trying and surface the failure.
   *
   * @param attempt the attempt about to be made (1-based)
   * @return whether to give up
   */
  default boolean shouldGiveUp(int attempt) {
    return false;
  }
}
