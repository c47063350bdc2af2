package com.worksync.collaboration.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksync.collaboration.config.RealtimeProperties;
import com.worksync.collaboration.realtime.ConnectionChannel;
import com.worksync.collaboration.realtime.OutboundEvent;
import java.io.IOException;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Adapts a Spring WebSocket session. Sends go through {@link ConcurrentWebSocketSessionDecorator}
 * so concurrent broadcasts keep per-connection order and a stalled client is cut off once it
 * exceeds the configured time or buffer limit.
 */
public class WebSocketConnectionChannel implements ConnectionChannel {

  private final WebSocketSession session;
  private final ObjectMapper objectMapper;

  public WebSocketConnectionChannel(
      WebSocketSession session, ObjectMapper objectMapper, RealtimeProperties properties) {
    this.session =
        new ConcurrentWebSocketSessionDecorator(
            session,
            Math.toIntExact(properties.sendTimeLimit().toMillis()),
            properties.sendBufferSizeLimit(),
            ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    this.objectMapper = objectMapper;
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
  public void send(OutboundEvent event) throws IOException {
    session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
  }
}
