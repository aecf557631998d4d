package eventsync.spring;

import eventsync.EventSync;
import eventsync.server.SyncSession;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket endpoint serving the sync protocol.
 *
 * <p>The tenant and user are read from the session attributes {@value #TENANT_ATTRIBUTE} and
 * {@value #USER_ATTRIBUTE}, which the application populates during the handshake (typically
 * from its authenticated principal in a {@code HandshakeInterceptor}). A session without a
 * tenant is closed with {@link CloseStatus#POLICY_VIOLATION}.
 */
public class EventSyncWebSocketHandler extends TextWebSocketHandler {
  public static final String TENANT_ATTRIBUTE = "eventsync.tenantId";
  public static final String USER_ATTRIBUTE = "eventsync.userId";

  private static final Logger logger = Logger.getLogger(EventSyncWebSocketHandler.class.getName());

  private final EventSync eventSync;
  private final int sendTimeLimitMs;
  private final int bufferSizeLimit;
  private final Map<String, SyncSession> sessions = new ConcurrentHashMap<>();

  public EventSyncWebSocketHandler(EventSync eventSync, int sendTimeLimitMs, int bufferSizeLimit) {
    this.eventSync = Objects.requireNonNull(eventSync, "eventSync");
    this.sendTimeLimitMs = sendTimeLimitMs;
    this.bufferSizeLimit = bufferSizeLimit;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    String tenantId = attribute(session, TENANT_ATTRIBUTE);
    if (tenantId == null) {
      logger.log(Level.WARNING, "Rejecting websocket session {0}: no tenant attribute", session.getId());
      session.close(CloseStatus.POLICY_VIOLATION.withReason("tenant required"));
      return;
    }
    String userId = attribute(session, USER_ATTRIBUTE);
    SyncSession syncSession = eventSync.openSession(tenantId, userId,
        new WebSocketClientChannel(session, sendTimeLimitMs, bufferSizeLimit));
    sessions.put(session.getId(), syncSession);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    SyncSession syncSession = sessions.get(session.getId());
    if (syncSession != null) {
      syncSession.onMessage(message.getPayload());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.log(Level.WARNING, "Transport error on websocket session " + session.getId(), exception);
    release(session);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    release(session);
  }

  /**
   * Returns the number of websocket sessions currently attached to a sync session.
   */
  public int sessionCount() {
    return sessions.size();
  }

  private void release(WebSocketSession session) {
    SyncSession syncSession = sessions.remove(session.getId());
    if (syncSession != null) {
      syncSession.onClose();
    }
  }

  private static String attribute(WebSocketSession session, String name) {
    Object value = session.getAttributes().get(name);
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isEmpty() ? null : text;
  }
}
