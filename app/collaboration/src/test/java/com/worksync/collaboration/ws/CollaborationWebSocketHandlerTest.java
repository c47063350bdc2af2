package com.worksync.collaboration.ws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksync.collaboration.config.RealtimeProperties;
import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.realtime.BroadcastDispatcher;
import com.worksync.collaboration.realtime.ConnectionRegistry;
import com.worksync.collaboration.realtime.LiveConnection;
import com.worksync.collaboration.realtime.OutboundEvent;
import com.worksync.collaboration.realtime.RecordingChannel;
import com.worksync.collaboration.realtime.RoomGateway;
import com.worksync.collaboration.service.CollaborationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class CollaborationWebSocketHandlerTest {

    private static final RealtimeProperties PROPERTIES = new RealtimeProperties(
            "/ws/collaboration", List.of("http://localhost:3000"), Duration.ofSeconds(10), 65536, true,
            Duration.ofMinutes(5));

    private RoomGateway roomGateway;
    private ConnectionRegistry registry;
    private CollaborationWebSocketHandler handler;
    private RecordingChannel channel;

    @BeforeEach
    void setUp() {
        roomGateway = mock(RoomGateway.class);
        registry = new ConnectionRegistry();
        final BroadcastDispatcher dispatcher =
                new BroadcastDispatcher(registry, new CollaborationMetrics(new SimpleMeterRegistry(), registry));
        handler = new CollaborationWebSocketHandler(roomGateway, registry, dispatcher, new ObjectMapper(), PROPERTIES);
        channel = new RecordingChannel("s-1");
        registry.register(LiveConnection.of(channel, UserIdentity.of("user-1", "a@example.com", "Alice")));
    }

    @Test
    void joinProjectFrameIsRoutedToGateway() {
        handler.handleTextMessage(session("s-1"), new TextMessage(
                "{\"event\":\"join_project\",\"data\":{\"projectId\":\"p-1\"}}"));

        verify(roomGateway).joinProject("s-1", "p-1");
    }

    @Test
    void leaveProjectFrameIsRoutedToGateway() {
        handler.handleTextMessage(session("s-1"), new TextMessage(
                "{\"event\":\"leave_project\",\"data\":{\"projectId\":\"p-1\"}}"));

        verify(roomGateway).leaveProject("s-1", "p-1");
    }

    @Test
    void bareIdIsAcceptedForSingleArgumentEvents() {
        handler.handleTextMessage(session("s-1"), new TextMessage("{\"event\":\"typing\",\"data\":\"t-1\"}"));

        verify(roomGateway).relayTyping("s-1", "t-1");
    }

    @Test
    void taskUpdateCarriesChanges() {
        handler.handleTextMessage(session("s-1"), new TextMessage(
                "{\"event\":\"task_updated\",\"data\":{\"taskId\":\"t-1\",\"projectId\":\"p-1\","
                        + "\"changes\":{\"status\":\"done\"}}}"));

        verify(roomGateway).relayTaskUpdated(eq("s-1"), eq("p-1"), eq("t-1"), any());
    }

    @Test
    void malformedFrameGetsErrorEvent() {
        handler.handleTextMessage(session("s-1"), new TextMessage("{not json"));

        assertThat(channel.sent()).containsExactly(OutboundEvent.error("Malformed message"));
        verifyNoInteractions(roomGateway);
    }

    @Test
    void missingArgumentGetsErrorEvent() {
        handler.handleTextMessage(session("s-1"), new TextMessage("{\"event\":\"join_project\",\"data\":{}}"));

        assertThat(channel.sent()).containsExactly(OutboundEvent.error("projectId is required"));
    }

    @Test
    void unknownEventGetsErrorEvent() {
        handler.handleTextMessage(session("s-1"), new TextMessage("{\"event\":\"dance\",\"data\":{}}"));

        assertThat(channel.sent()).containsExactly(OutboundEvent.error("Unsupported event: dance"));
    }

    @Test
    void sessionWithoutIdentityIsClosed() throws Exception {
        final WebSocketSession session = session("s-2");
        when(session.getAttributes()).thenReturn(new HashMap<>());

        handler.afterConnectionEstablished(session);

        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verifyNoInteractions(roomGateway);
    }

    @Test
    void authenticatedSessionIsConnected() throws Exception {
        final WebSocketSession session = session("s-2");
        final UserIdentity identity = UserIdentity.of("user-2", "b@example.com", "Bob");
        when(session.getAttributes()).thenReturn(
                new HashMap<>(Map.of(BearerTokenHandshakeInterceptor.IDENTITY_ATTRIBUTE, identity)));

        handler.afterConnectionEstablished(session);

        verify(roomGateway).connect(any(WebSocketConnectionChannel.class), eq(identity));
    }

    @Test
    void closeDisconnects() {
        handler.afterConnectionClosed(session("s-1"), CloseStatus.NORMAL);

        verify(roomGateway).disconnect("s-1");
    }

    private static WebSocketSession session(String id) {
        final WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        return session;
    }
}
