package eventsync.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes durable log rows whose retention boundary has passed.
 *
 * @see eventsync.purge.EventPurgeScheduler
 */
public interface EventPurger {

  /**
   * Deletes up to {@code limit} rows with {@code expires_at < before}.
   *
   * @param conn the connection to use (auto-commit)
   * @param before exclusive expiry cutoff
   * @param limit maximum rows to delete in this batch
   * @return number of rows deleted
   */
  int purge(Connection conn, Instant before, int limit);
}
