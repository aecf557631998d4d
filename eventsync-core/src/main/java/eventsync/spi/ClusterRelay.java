package eventsync.spi;

import eventsync.SyncEvent;
import eventsync.presence.PresenceChange;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Pub/sub fabric relaying emitted events and presence changes between server processes.
 *
 * <p>Each process only holds the sockets it physically owns. An event emitted in one process is
 * published here; every other process receives it through its subscriber and fans it out to its
 * own local connections. Presence changes travel the same way so that viewers connected to
 * another process see joins, updates and departures. The {@link #NOOP} relay is used for
 * single-node deployments.
 */
public interface ClusterRelay {

  /**
   * Relay that neither publishes nor delivers anything.
   */
  ClusterRelay NOOP = new ClusterRelay() {
    @Override
    public void publish(SyncEvent event) {
    }

    @Override
    public void subscribe(Consumer<SyncEvent> subscriber) {
    }

    @Override
    public void publishPresence(String tenantId, PresenceChange change) {
    }

    @Override
    public void subscribePresence(BiConsumer<String, PresenceChange> subscriber) {
    }
  };

  /**
   * Publishes an event emitted by this process to all other processes.
   *
   * @param event the emitted event
   */
  void publish(SyncEvent event);

  /**
   * Registers this process's receiver of events emitted elsewhere. The subscriber must not be
   * invoked for events this process published itself.
   *
   * @param subscriber the receiver
   */
  void subscribe(Consumer<SyncEvent> subscriber);

  /**
   * Publishes a broadcast presence change made through this process.
   *
   * @param tenantId the tenant the entity belongs to
   * @param change a joined, updated or left change
   */
  void publishPresence(String tenantId, PresenceChange change);

  /**
   * Registers this process's receiver of presence changes made elsewhere, called with the tenant
   * and the change. Like {@link #subscribe}, never invoked for this process's own changes.
   *
   * @param subscriber the receiver
   */
  void subscribePresence(BiConsumer<String, PresenceChange> subscriber);
}
