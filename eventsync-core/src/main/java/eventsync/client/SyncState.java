package eventsync.client;

/**
 * Connection states of a {@link SyncClient}.
 */
public enum SyncState {
  /** No transport open; a reconnect may be pending. */
  DISCONNECTED,
  /** A transport connection is being opened. */
  CONNECTING,
  /** Open; catching up on events missed while away. Live pushes are buffered. */
  SYNCING,
  /** Caught up; live pushes are applied as they arrive. */
  LIVE,
  /** The reconnect policy gave up. Terminal. */
  FAILED
}
