package eventsync.spring;

import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory session that records outbound text frames.
 */
class StubWebSocketSession implements WebSocketSession {
  private final String id = UUID.randomUUID().toString();
  private final Map<String, Object> attributes = new ConcurrentHashMap<>();
  private final List<String> sent = new CopyOnWriteArrayList<>();
  private volatile boolean open = true;
  private volatile CloseStatus closeStatus;

  StubWebSocketSession(String tenantId, String userId) {
    if (tenantId != null) {
      attributes.put(EventSyncWebSocketHandler.TENANT_ATTRIBUTE, tenantId);
    }
    if (userId != null) {
      attributes.put(EventSyncWebSocketHandler.USER_ATTRIBUTE, userId);
    }
  }

  List<String> sent() {
    return sent;
  }

  boolean sentContaining(String fragment) {
    return sent.stream().anyMatch(frame -> frame.contains(fragment));
  }

  CloseStatus closeStatus() {
    return closeStatus;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public URI getUri() {
    return URI.create("ws://localhost/ws/sync");
  }

  @Override
  public HttpHeaders getHandshakeHeaders() {
    return new HttpHeaders();
  }

  @Override
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @Override
  public Principal getPrincipal() {
    return null;
  }

  @Override
  public InetSocketAddress getLocalAddress() {
    return null;
  }

  @Override
  public InetSocketAddress getRemoteAddress() {
    return null;
  }

  @Override
  public String getAcceptedProtocol() {
    return null;
  }

  @Override
  public void setTextMessageSizeLimit(int messageSizeLimit) {
  }

  @Override
  public int getTextMessageSizeLimit() {
    return 64 * 1024;
  }

  @Override
  public void setBinaryMessageSizeLimit(int messageSizeLimit) {
  }

  @Override
  public int getBinaryMessageSizeLimit() {
    return 64 * 1024;
  }

  @Override
  public List<WebSocketExtension> getExtensions() {
    return List.of();
  }

  @Override
  public void sendMessage(WebSocketMessage<?> message) {
    if (message instanceof TextMessage text) {
      sent.add(text.getPayload());
    }
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    close(CloseStatus.NORMAL);
  }

  @Override
  public void close(CloseStatus status) {
    open = false;
    closeStatus = status;
  }
}
