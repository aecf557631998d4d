package eventsync.client;

import eventsync.EventType;
import eventsync.SyncEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Explicit dispatch table from event types to client-side handlers.
 *
 * <p>Handlers registered for a type run before handlers registered for all types, each group in
 * registration order. A handler that throws is logged and does not stop the others.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventHandlerTable handlers = new EventHandlerTable()
 *     .on(EventType.LEAD_UPDATED, event -> leadCache.invalidate(event))
 *     .onEntity(EventType.EntityKind.CASE, event -> caseList.refresh())
 *     .onAll(event -> audit.record(event));
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class EventHandlerTable {
  private static final Logger logger = Logger.getLogger(EventHandlerTable.class.getName());

  private final Map<EventType, CopyOnWriteArrayList<EventHandler>> handlers =
      Collections.synchronizedMap(new EnumMap<>(EventType.class));
  private final CopyOnWriteArrayList<EventHandler> all = new CopyOnWriteArrayList<>();

  /**
   * Registers a handler for one event type.
   *
   * @param eventType the event type
   * @param handler the handler
   * @return this table for chaining
   */
  public EventHandlerTable on(EventType eventType, EventHandler handler) {
    handlers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    return this;
  }

  /**
   * Registers a handler for the created, updated and deleted events of one entity kind.
   *
   * @param entityKind the entity kind
   * @param handler the handler
   * @return this table for chaining
   */
  public EventHandlerTable onEntity(EventType.EntityKind entityKind, EventHandler handler) {
    for (EventType type : EventType.values()) {
      if (type.entityKind() == entityKind) {
        on(type, handler);
      }
    }
    return this;
  }

  /**
   * Registers a handler for every event type.
   *
   * @param handler the handler
   * @return this table for chaining
   */
  public EventHandlerTable onAll(EventHandler handler) {
    all.add(handler);
    return this;
  }

  public List<EventHandler> handlersFor(EventType eventType) {
    List<EventHandler> result = new ArrayList<>();
    List<EventHandler> specific = handlers.get(eventType);
    if (specific != null) {
      result.addAll(specific);
    }
    result.addAll(all);
    return Collections.unmodifiableList(result);
  }

  /**
   * Invokes every handler registered for the event's type.
   *
   * @param event the event
   * @return number of handlers that completed normally
   */
  public int dispatch(SyncEvent event) {
    int handled = 0;
    for (EventHandler handler : handlersFor(event.eventType())) {
      try {
        handler.handle(event);
        handled++;
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Handler failed for " + event, e);
      }
    }
    return handled;
  }
}
