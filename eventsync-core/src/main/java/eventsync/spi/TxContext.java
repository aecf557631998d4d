package eventsync.spi;

/**
 * Bridges to the host application's transaction so emission can be deferred until the mutation
 * that caused it has committed.
 *
 * @see eventsync.EventEmitter#emitAfterCommit
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @param callback action to execute post-commit
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);
}
