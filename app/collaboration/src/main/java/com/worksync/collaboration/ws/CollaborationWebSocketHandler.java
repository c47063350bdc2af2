/*
 * Where: WebSocket transport
 * What: maps socket lifecycle and inbound frames onto the room gateway
 * Why: the gateway stays transport-agnostic and testable without a servlet container
 */
package com.worksync.collaboration.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksync.collaboration.config.RealtimeProperties;
import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.realtime.BroadcastDispatcher;
import com.worksync.collaboration.realtime.ConnectionRegistry;
import com.worksync.collaboration.realtime.OutboundEvent;
import com.worksync.collaboration.realtime.RoomGateway;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@RequiredArgsConstructor
public class CollaborationWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(CollaborationWebSocketHandler.class);
    private static final String MDC_CONNECTION_ID = "connection_id";
    private static final String MDC_USER_ID = "user_id";

    private final RoomGateway roomGateway;
    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final RealtimeProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        final Object attribute = session.getAttributes().get(BearerTokenHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        if (!(attribute instanceof UserIdentity identity)) {
            // the handshake interceptor should have refused this upgrade
            logger.warn("connection without identity closed sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        roomGateway.connect(new WebSocketConnectionChannel(session, objectMapper, properties), identity);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        final String connectionId = session.getId();
        MDC.put(MDC_CONNECTION_ID, connectionId);
        registry.connection(connectionId).ifPresent(connection -> MDC.put(MDC_USER_ID, connection.userId()));
        try {
            final InboundMessage inbound = objectMapper.readValue(message.getPayload(), InboundMessage.class);
            dispatch(connectionId, inbound);
        } catch (JsonProcessingException ex) {
            logger.debug("malformed frame dropped", ex);
            replyError(connectionId, "Malformed message");
        } catch (IllegalArgumentException ex) {
            replyError(connectionId, ex.getMessage());
        } finally {
            MDC.remove(MDC_CONNECTION_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.debug("transport error sessionId={}", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        roomGateway.disconnect(session.getId());
    }

    void dispatch(String connectionId, InboundMessage inbound) {
        final String event = inbound.event() == null ? "" : inbound.event();
        switch (event) {
            case InboundMessage.JOIN_USER_ROOM -> roomGateway.joinUserRoom(connectionId, inbound.idArgument("userId"));
            case InboundMessage.JOIN_PROJECT -> roomGateway.joinProject(connectionId, inbound.idArgument("projectId"));
            case InboundMessage.LEAVE_PROJECT -> roomGateway.leaveProject(connectionId, inbound.idArgument("projectId"));
            case InboundMessage.TASK_UPDATED -> roomGateway.relayTaskUpdated(
                    connectionId,
                    inbound.requiredText("projectId"),
                    inbound.requiredText("taskId"),
                    inbound.optionalNode("changes"));
            case InboundMessage.COMMENT_ADDED -> roomGateway.relayCommentAdded(
                    connectionId,
                    inbound.requiredText("projectId"),
                    inbound.requiredText("taskId"),
                    inbound.optionalNode("comment"));
            case InboundMessage.TYPING -> roomGateway.relayTyping(connectionId, inbound.idArgument("taskId"));
            case InboundMessage.VIEWING -> roomGateway.relayViewing(
                    connectionId, inbound.requiredText("entityId"), inbound.requiredText("entityType"));
            default -> replyError(connectionId, "Unsupported event: " + event);
        }
    }

    private void replyError(String connectionId, String message) {
        registry.connection(connectionId)
                .ifPresent(connection -> dispatcher.deliverToConnection(connection, OutboundEvent.error(message)));
    }
}
