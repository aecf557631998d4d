package eventsync.jdbc.purge;

/**
 * PostgreSQL event purger. PostgreSQL has no {@code DELETE ... LIMIT}, so the batch is bounded
 * by the subquery from {@link AbstractJdbcEventPurger}.
 */
public final class PostgresEventPurger extends AbstractJdbcEventPurger {

  public PostgresEventPurger() {
    super();
  }

  public PostgresEventPurger(String tableName) {
    super(tableName);
  }
}
