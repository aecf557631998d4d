package eventsync.spring;

import eventsync.spi.TxContext;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;

/**
 * {@link TxContext} implementation that bridges to Spring's transaction infrastructure
 * via {@link TransactionSynchronizationManager}.
 *
 * <p>After-commit callbacks are registered as {@link TransactionSynchronization} instances, so
 * {@code emitAfterCommit} called inside a {@code @Transactional} service method notifies clients
 * only once the business change is durable.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive()
        && TransactionSynchronizationManager.isSynchronizationActive();
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    if (!isTransactionActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register afterCommit callback");
    }
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        callback.run();
      }
    });
  }
}
