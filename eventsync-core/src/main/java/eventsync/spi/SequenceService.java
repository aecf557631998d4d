package eventsync.spi;

/**
 * Allocates the per-tenant sequence numbers that totally order a tenant's events.
 *
 * <p>Implementations must be atomic per tenant. A per-process counter is only correct while a
 * single process emits for the tenant; deployments with several processes need a shared,
 * atomically incremented counter such as {@code eventsync.jdbc.sequence.JdbcSequenceService}.
 */
public interface SequenceService {

  /**
   * Returns the next sequence number for the tenant, strictly greater than any returned before.
   *
   * @param tenantId the tenant
   * @return the allocated sequence number (&ge; 1)
   */
  long nextSequence(String tenantId);

  /**
   * Returns the last sequence number issued for the tenant, or {@code 0} if none.
   *
   * @param tenantId the tenant
   * @return the last issued sequence number
   */
  long currentSequence(String tenantId);
}
