package eventsync.spring.boot;

import eventsync.EventSync;
import eventsync.spring.EventSyncWebSocketHandler;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;

/**
 * Exposes the sync protocol at {@code eventsync.websocket.path} in servlet web applications.
 *
 * <p>The application must put the authenticated tenant (and user) into the handshake
 * attributes; see {@link EventSyncWebSocketHandler}. Interceptors are added by declaring a
 * {@link HandshakeCustomizer} bean.
 */
@AutoConfiguration(after = EventSyncAutoConfiguration.class)
@ConditionalOnClass({WebSocketConfigurer.class, EventSync.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnBean(EventSync.class)
@ConditionalOnProperty(prefix = "eventsync.websocket", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventSyncProperties.class)
@EnableWebSocket
public class EventSyncWebSocketAutoConfiguration {

  /**
   * Hook to adjust the handler registration, e.g. to add a {@code HandshakeInterceptor} that
   * copies the authenticated tenant into the session attributes.
   */
  @FunctionalInterface
  public interface HandshakeCustomizer {
    void customize(WebSocketHandlerRegistration registration);
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSyncWebSocketHandler eventSyncWebSocketHandler(EventSync eventSync, EventSyncProperties props) {
    return new EventSyncWebSocketHandler(eventSync,
        props.getWebsocket().getSendTimeLimitMs(), props.getWebsocket().getBufferSizeLimit());
  }

  @Bean
  public WebSocketConfigurer eventSyncWebSocketConfigurer(EventSyncWebSocketHandler handler,
      EventSyncProperties props,
      ObjectProvider<HandshakeCustomizer> customizers) {
    return registry -> {
      WebSocketHandlerRegistration registration =
          registry.addHandler(handler, props.getWebsocket().getPath());
      if (!props.getWebsocket().getAllowedOriginPatterns().isEmpty()) {
        registration.setAllowedOriginPatterns(
            props.getWebsocket().getAllowedOriginPatterns().toArray(String[]::new));
      }
      customizers.orderedStream().forEach(c -> c.customize(registration));
    };
  }
}
