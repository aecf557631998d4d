package eventsync.store;

import eventsync.SyncEvent;

import java.util.List;
import java.util.Objects;

/**
 * Answer to a catch-up request: the ordered events above the client's cursor plus how the
 * client must proceed.
 *
 * @param status whether the batch is complete, partial, unrecoverable or unavailable
 * @param events events with {@code sequenceNumber > since}, ascending, without duplicates
 * @param headSequence highest sequence number known after this batch; the client's next cursor
 */
public record CatchUpResult(Status status, List<SyncEvent> events, long headSequence) {

  public CatchUpResult {
    Objects.requireNonNull(status, "status");
    events = List.copyOf(Objects.requireNonNull(events, "events"));
  }

  /** How a client must treat a catch-up answer. */
  public enum Status {
    /** Every retained event above the cursor is in the batch. */
    COMPLETE,
    /** The batch hit the limit; more events remain and must be requested. */
    PARTIAL,
    /** The cursor predates the retention window; the client must refresh its state in full. */
    GAP,
    /** The store could not be read; the client should retry later. */
    UNAVAILABLE
  }

  public static CatchUpResult complete(List<SyncEvent> events, long since) {
    return new CatchUpResult(Status.COMPLETE, events, head(events, since));
  }

  public static CatchUpResult partial(List<SyncEvent> events, long since) {
    return new CatchUpResult(Status.PARTIAL, events, head(events, since));
  }

  /**
   * @param headSequence the tenant's current head, where the client resumes after refreshing
   */
  public static CatchUpResult gap(long headSequence) {
    return new CatchUpResult(Status.GAP, List.of(), headSequence);
  }

  public static CatchUpResult unavailable(long since) {
    return new CatchUpResult(Status.UNAVAILABLE, List.of(), since);
  }

  public boolean hasMore() {
    return status == Status.PARTIAL;
  }

  public boolean isGap() {
    return status == Status.GAP;
  }

  private static long head(List<SyncEvent> events, long since) {
    return events.isEmpty() ? since : events.get(events.size() - 1).sequenceNumber();
  }
}
