package eventsync.spring;

import eventsync.spi.ClientChannel;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}.
 *
 * <p>Writes go through a {@link ConcurrentWebSocketSessionDecorator} because Spring sessions do
 * not allow concurrent sends, and keep-alive pings race with event pushes.
 */
public final class WebSocketClientChannel implements ClientChannel {
  private static final Logger logger = Logger.getLogger(WebSocketClientChannel.class.getName());

  private final WebSocketSession session;

  public WebSocketClientChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
    Objects.requireNonNull(session, "session");
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(String text) throws IOException {
    session.sendMessage(new TextMessage(text));
  }

  @Override
  public void close() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.NORMAL);
    } catch (IOException e) {
      logger.log(Level.FINE, "Failed to close websocket session " + session.getId(), e);
    }
  }
}
