package eventsync.broadcast;

import eventsync.SyncEvent;
import eventsync.presence.PresenceChange;
import eventsync.spi.ClusterRelay;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relay fabric connecting several nodes inside one JVM, mainly for tests and embedded setups.
 *
 * <p>Each {@link #join()} returns a node endpoint. An event or presence change published on one
 * endpoint is delivered synchronously to the subscribers of every other endpoint, never back to
 * its own.
 */
public final class InMemoryClusterRelay {
  private static final Logger logger = Logger.getLogger(InMemoryClusterRelay.class.getName());

  private final List<Node> nodes = new CopyOnWriteArrayList<>();

  /**
   * Adds a node to the fabric.
   *
   * @return the node's relay endpoint
   */
  public ClusterRelay join() {
    Node node = new Node();
    nodes.add(node);
    return node;
  }

  private final class Node implements ClusterRelay {
    private final List<Consumer<SyncEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final List<BiConsumer<String, PresenceChange>> presenceSubscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(SyncEvent event) {
      for (Node node : nodes) {
        if (node == this) {
          continue;
        }
        for (Consumer<SyncEvent> subscriber : node.subscribers) {
          try {
            subscriber.accept(event);
          } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Relay subscriber failed for " + event, e);
          }
        }
      }
    }

    @Override
    public void subscribe(Consumer<SyncEvent> subscriber) {
      subscribers.add(subscriber);
    }

    @Override
    public void publishPresence(String tenantId, PresenceChange change) {
      for (Node node : nodes) {
        if (node == this) {
          continue;
        }
        for (BiConsumer<String, PresenceChange> subscriber : node.presenceSubscribers) {
          try {
            subscriber.accept(tenantId, change);
          } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Presence relay subscriber failed for " + change, e);
          }
        }
      }
    }

    @Override
    public void subscribePresence(BiConsumer<String, PresenceChange> subscriber) {
      presenceSubscribers.add(subscriber);
    }
  }
}
