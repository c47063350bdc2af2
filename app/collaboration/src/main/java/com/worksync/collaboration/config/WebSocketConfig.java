package com.worksync.collaboration.config;

import com.worksync.collaboration.ws.BearerTokenHandshakeInterceptor;
import com.worksync.collaboration.ws.CollaborationWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final CollaborationWebSocketHandler handler;
  private final BearerTokenHandshakeInterceptor handshakeInterceptor;
  private final RealtimeProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, properties.endpoint())
        .addInterceptors(handshakeInterceptor)
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}
