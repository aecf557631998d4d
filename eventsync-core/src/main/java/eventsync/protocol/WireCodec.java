package eventsync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eventsync.EventType;
import eventsync.SyncEvent;
import eventsync.presence.PresenceAction;
import eventsync.presence.PresenceChange;
import eventsync.presence.PresenceState;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON text-frame codec for both directions of the sync protocol.
 *
 * <p>Encoding never fails for well-formed messages. Decoding throws {@link ProtocolException}
 * for anything that is not a known message shape.
 */
public final class WireCodec {
  private static final Logger logger = Logger.getLogger(WireCodec.class.getName());
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String SYNC_RESPONSE = "sync_response";
  static final String PING = "ping";
  static final String PONG = "pong";
  static final String INITIAL_PRESENCE = "initial_presence";
  static final String PRESENCE = "presence";

  private WireCodec() {
  }

  // ---- payloads ----

  /**
   * Validates that {@code json} is a JSON object and returns its compact form.
   *
   * @param json the payload text, {@code null} is treated as an empty object
   * @return compact JSON text
   * @throws ProtocolException if the text is not a JSON object
   */
  public static String normalizePayload(String json) {
    if (json == null || json.isBlank()) {
      return "{}";
    }
    JsonNode node = parse(json);
    if (!node.isObject()) {
      throw new ProtocolException("payload must be a JSON object");
    }
    return node.toString();
  }

  /**
   * Serializes a payload value (map, record, bean) into JSON object text.
   *
   * @param value the payload value
   * @return JSON text
   * @throws ProtocolException if the value cannot be serialized as an object
   */
  public static String payloadOf(Object value) {
    if (value == null) {
      return "{}";
    }
    JsonNode node = MAPPER.valueToTree(value);
    if (!node.isObject()) {
      throw new ProtocolException("payload must serialize to a JSON object, got " + node.getNodeType());
    }
    return node.toString();
  }

  // ---- server to client ----

  public static String encode(ServerMessage message) {
    ObjectNode root;
    if (message instanceof ServerMessage.EventPush push) {
      root = eventNode(push.event());
    } else if (message instanceof ServerMessage.SyncResponse response) {
      root = MAPPER.createObjectNode();
      root.put("type", SYNC_RESPONSE);
      ArrayNode events = root.putArray("events");
      for (SyncEvent event : response.events()) {
        events.add(eventNode(event));
      }
      root.put("hasMore", response.hasMore());
      root.put("gap", response.gap());
      root.put("unavailable", response.unavailable());
      root.put("lastSequenceNumber", response.lastSequenceNumber());
    } else if (message instanceof ServerMessage.Ping) {
      root = MAPPER.createObjectNode();
      root.put("type", PING);
    } else if (message instanceof ServerMessage.PresenceNotice notice) {
      root = MAPPER.createObjectNode();
      root.put("type", notice.kind().messageType());
      root.set("payload", presenceNode(notice.presence()));
    } else if (message instanceof ServerMessage.InitialPresence initial) {
      root = MAPPER.createObjectNode();
      root.put("type", INITIAL_PRESENCE);
      ObjectNode payload = root.putObject("payload");
      payload.put("entityType", initial.entityType());
      payload.put("entityId", initial.entityId());
      ArrayNode users = payload.putArray("users");
      for (PresenceState state : initial.users()) {
        users.add(presenceNode(state));
      }
    } else {
      throw new IllegalArgumentException("Unsupported message: " + message);
    }
    return root.toString();
  }

  public static ServerMessage decodeServerMessage(String text) {
    JsonNode root = parseObject(text);
    String type = textOrNull(root, "type");
    if (type == null) {
      if (root.hasNonNull("eventType")) {
        return new ServerMessage.EventPush(eventOf(root));
      }
      throw new ProtocolException("Frame has neither type nor eventType");
    }
    switch (type) {
      case SYNC_RESPONSE:
        List<SyncEvent> events = new ArrayList<>();
        for (JsonNode node : root.path("events")) {
          try {
            events.add(eventOf(node));
          } catch (ProtocolException e) {
            logger.log(Level.WARNING, "Skipping event in sync_response: " + e.getMessage());
          }
        }
        return new ServerMessage.SyncResponse(events,
            root.path("hasMore").asBoolean(false),
            root.path("gap").asBoolean(false),
            root.path("unavailable").asBoolean(false),
            root.path("lastSequenceNumber").asLong(0L));
      case PING:
        return new ServerMessage.Ping();
      case INITIAL_PRESENCE:
        JsonNode payload = root.path("payload");
        List<PresenceState> users = new ArrayList<>();
        for (JsonNode node : payload.path("users")) {
          users.add(presenceOf(node));
        }
        return new ServerMessage.InitialPresence(
            requireText(payload, "entityType"), requireText(payload, "entityId"), users);
      default:
        for (PresenceChange.Kind kind : PresenceChange.Kind.values()) {
          if (type.equals(kind.messageType())) {
            return new ServerMessage.PresenceNotice(kind, presenceOf(root.path("payload")));
          }
        }
        throw new ProtocolException("Unknown message type: " + type);
    }
  }

  // ---- client to server ----

  public static String encode(ClientMessage message) {
    ObjectNode root = MAPPER.createObjectNode();
    if (message instanceof ClientMessage.Subscribe subscribe) {
      root.put("action", "subscribe");
      ArrayNode events = root.putArray("events");
      for (EventType type : subscribe.events()) {
        events.add(type.wireName());
      }
    } else if (message instanceof ClientMessage.Sync sync) {
      root.put("action", "sync");
      root.put("lastEventId", sync.lastEventId());
    } else if (message instanceof ClientMessage.Presence presence) {
      // presence frames carry the presence action itself in "action"
      root.put("action", presence.action().wireName());
      root.put("entityType", presence.entityType());
      root.put("entityId", presence.entityId());
      if (presence.userId() != null) {
        root.put("userId", presence.userId());
      }
      if (presence.userName() != null) {
        root.put("userName", presence.userName());
      }
    } else if (message instanceof ClientMessage.Pong pong) {
      root.put("type", PONG);
      root.put("lastEventId", pong.lastEventId());
    } else {
      throw new IllegalArgumentException("Unsupported message: " + message);
    }
    return root.toString();
  }

  public static ClientMessage decodeClientMessage(String text) {
    JsonNode root = parseObject(text);
    if (PONG.equals(textOrNull(root, "type"))) {
      return new ClientMessage.Pong(root.path("lastEventId").asLong(0L));
    }
    String action = textOrNull(root, "action");
    if (action == null) {
      throw new ProtocolException("Frame has no action");
    }
    if (root.hasNonNull("entityId")) {
      return presenceMessageOf(root, action);
    }
    switch (action) {
      case "subscribe":
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        for (JsonNode node : root.path("events")) {
          EventType.fromWireName(node.asText()).ifPresentOrElse(types::add,
              () -> logger.log(Level.FINE, "Ignoring subscription to unknown event type {0}", node));
        }
        return new ClientMessage.Subscribe(types);
      case "sync":
        JsonNode cursor = root.path("lastEventId");
        if (!cursor.isMissingNode() && !cursor.isNull() && !cursor.canConvertToLong()) {
          throw new ProtocolException("lastEventId must be an integer");
        }
        long lastEventId = cursor.asLong(0L);
        if (lastEventId < 0) {
          throw new ProtocolException("lastEventId must be >= 0");
        }
        return new ClientMessage.Sync(lastEventId);
      default:
        throw new ProtocolException("Unknown action: " + action);
    }
  }

  private static ClientMessage presenceMessageOf(JsonNode root, String action) {
    // a bare "presence" action names no state and only keeps the record alive
    PresenceAction presenceAction = PRESENCE.equals(action)
        ? PresenceAction.HEARTBEAT
        : PresenceAction.fromWireName(action)
            .orElseThrow(() -> new ProtocolException("Unknown presence action: " + action));
    return new ClientMessage.Presence(
        requireText(root, "entityType"),
        requireText(root, "entityId"),
        presenceAction,
        textOrNull(root, "userId"),
        textOrNull(root, "userName"));
  }

  // ---- helpers ----

  private static ObjectNode eventNode(SyncEvent event) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("id", event.id());
    node.put("sequenceNumber", event.sequenceNumber());
    node.put("tenantId", event.tenantId());
    node.put("eventType", event.eventType().wireName());
    node.set("payload", parse(event.payloadJson()));
    node.put("timestamp", event.timestamp().toString());
    if (event.userId() != null) {
      node.put("userId", event.userId());
    }
    return node;
  }

  private static SyncEvent eventOf(JsonNode node) {
    try {
      JsonNode payload = node.path("payload");
      return SyncEvent.builder(EventType.ofWireName(requireText(node, "eventType")))
          .id(requireText(node, "id"))
          .sequenceNumber(node.path("sequenceNumber").asLong(0L))
          .tenantId(requireText(node, "tenantId"))
          .payloadJson(payload.isObject() ? payload.toString() : "{}")
          .userId(textOrNull(node, "userId"))
          .timestamp(instantOrNull(node, "timestamp"))
          .build();
    } catch (IllegalArgumentException e) {
      throw new ProtocolException("Invalid event: " + e.getMessage(), e);
    }
  }

  private static ObjectNode presenceNode(PresenceState state) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("userId", state.userId());
    node.put("userName", state.userName());
    node.put("entityType", state.entityType());
    node.put("entityId", state.entityId());
    node.put("action", state.action().wireName());
    node.put("timestamp", state.timestamp().toString());
    return node;
  }

  private static PresenceState presenceOf(JsonNode node) {
    PresenceAction action = PresenceAction.fromWireName(textOrNull(node, "action"))
        .filter(PresenceAction::isState)
        .orElse(PresenceAction.VIEWING);
    Instant timestamp = instantOrNull(node, "timestamp");
    return new PresenceState(
        requireText(node, "userId"),
        textOrNull(node, "userName"),
        requireText(node, "entityType"),
        requireText(node, "entityId"),
        action,
        timestamp != null ? timestamp : Instant.now());
  }

  private static JsonNode parse(String text) {
    try {
      return MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      throw new ProtocolException("Malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static JsonNode parseObject(String text) {
    if (text == null) {
      throw new ProtocolException("Empty frame");
    }
    JsonNode root = parse(text);
    if (root == null || !root.isObject()) {
      throw new ProtocolException("Frame is not a JSON object");
    }
    return root;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static String requireText(JsonNode node, String field) {
    String value = textOrNull(node, field);
    if (value == null || value.isEmpty()) {
      throw new ProtocolException("Missing field: " + field);
    }
    return value;
  }

  private static Instant instantOrNull(JsonNode node, String field) {
    String value = textOrNull(node, field);
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new ProtocolException("Invalid " + field + ": " + value, e);
    }
  }
}
