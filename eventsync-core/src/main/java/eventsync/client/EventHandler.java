package eventsync.client;

import eventsync.SyncEvent;

/**
 * Callback for events applied by a {@link SyncClient}.
 */
@FunctionalInterface
public interface EventHandler {

  void handle(SyncEvent event);
}
