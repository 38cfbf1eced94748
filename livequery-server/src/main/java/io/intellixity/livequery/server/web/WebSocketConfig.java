package io.intellixity.livequery.server.web;

import io.intellixity.livequery.server.config.LiveQueryProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final HubWebSocketHandler handler;
  private final LiveQueryProperties props;

  public WebSocketConfig(HubWebSocketHandler handler, LiveQueryProperties props) {
    this.handler = handler;
    this.props = props;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, props.getEndpoint())
        .addInterceptors(new BearerTokenHandshakeInterceptor(props.getSecurity().isRequireToken()))
        .setAllowedOriginPatterns(props.getAllowedOrigins().toArray(new String[0]));
  }
}
