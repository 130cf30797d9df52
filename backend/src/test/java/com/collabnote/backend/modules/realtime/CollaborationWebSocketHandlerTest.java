package com.collabnote.backend.modules.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.collabnote.backend.modules.auth.application.JwtTokenService;
import com.collabnote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.collabnote.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.collabnote.backend.modules.collaboration.application.event.EventBus;
import com.collabnote.backend.modules.collaboration.domain.AnnotationTarget;
import com.collabnote.backend.modules.realtime.application.BroadcastRouter;
import com.collabnote.backend.modules.realtime.application.ConnectionRegistry;
import com.collabnote.backend.modules.realtime.application.PresenceService;
import com.collabnote.backend.modules.realtime.application.RealtimeProperties;
import com.collabnote.backend.modules.realtime.domain.ClientConnection;
import com.collabnote.backend.modules.realtime.infrastructure.websocket.CollaborationHandshakeInterceptor;
import com.collabnote.backend.modules.realtime.domain.PresenceStatus;
import com.collabnote.backend.modules.realtime.infrastructure.websocket.CollaborationWebSocketHandler;
import com.collabnote.backend.support.RecordingOutboundChannel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

class CollaborationWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private ConnectionRegistry registry;
    private JwtTokenService jwtTokenService;
    private CollaborationWebSocketHandler handler;
    private WebSocketSession session;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        RealtimeProperties properties = new RealtimeProperties(null, null, null, null, null, 2, null, null, null, null);
        registry = new ConnectionRegistry(Runnable::run, properties, Clock.systemUTC());
        BroadcastRouter router = new BroadcastRouter(new EventBus(), registry, objectMapper, Clock.systemUTC());
        PresenceService presenceService = new PresenceService(registry, router, properties);
        jwtTokenService = mock(JwtTokenService.class);
        handler = new CollaborationWebSocketHandler(registry, router, presenceService, jwtTokenService, objectMapper, properties);

        attributes = new HashMap<>();
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
    }

    @Test
    void handshakeIdentityOpensConnection() throws Exception {
        attributes.put(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE, 5L);
        attributes.put(CollaborationHandshakeInterceptor.WORKSPACE_ID_ATTRIBUTE, 3L);

        handler.afterConnectionEstablished(session);

        ClientConnection connection = registry.find("s1").orElseThrow();
        assertThat(connection.isOpen()).isTrue();
        assertThat(connection.getUserId()).isEqualTo(5L);
        assertThat(connection.getWorkspaceId()).isEqualTo(3L);
    }

    @Test
    void subscribeRequiresAuthentication() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"subscribe\",\"targetType\":\"policy\",\"targetId\":\"42\"}"));

        JsonNode reply = lastReply();
        assertThat(reply.path("type").asText()).isEqualTo("error");
        assertThat(reply.path("data").path("code").asText()).isEqualTo("AUTH_REQUIRED");
        assertThat(registry.find("s1").orElseThrow().getActiveTargets()).isEmpty();
    }

    @Test
    void authThenSubscribeUpdatesActiveTargets() throws Exception {
        when(jwtTokenService.parseAccessToken("good-token")).thenReturn(new ParsedToken(
                8L, "user8", List.of("USER"), OffsetDateTime.now(), OffsetDateTime.now().plusMinutes(5)
        ));
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"auth\",\"token\":\"good-token\"}"));
        JsonNode authAck = lastReply();
        assertThat(authAck.path("type").asText()).isEqualTo("ack");
        assertThat(authAck.path("data").path("userId").asLong()).isEqualTo(8L);

        handler.handleMessage(session, new TextMessage("{\"type\":\"subscribe\",\"targetType\":\"policy\",\"targetId\":\"42\"}"));
        assertThat(lastReply().path("data").path("action").asText()).isEqualTo("subscribe");

        ClientConnection connection = registry.find("s1").orElseThrow();
        assertThat(connection.isAuthenticated()).isTrue();
        assertThat(connection.hasTarget(AnnotationTarget.of("policy", "42"))).isTrue();

        handler.handleMessage(session, new TextMessage("{\"type\":\"unsubscribe\",\"targetType\":\"policy\",\"targetId\":\"42\"}"));
        assertThat(connection.getActiveTargets()).isEmpty();

        handler.handleMessage(session, new TextMessage("{\"type\":\"workspace\",\"workspaceId\":12}"));
        assertThat(connection.getWorkspaceId()).isEqualTo(12L);
    }

    @Test
    void invalidAuthTokenIsReported() throws Exception {
        when(jwtTokenService.parseAccessToken("bad")).thenThrow(new InvalidTokenException("Invalid access token", null));
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"auth\",\"token\":\"bad\"}"));

        assertThat(lastReply().path("data").path("code").asText()).isEqualTo("INVALID_TOKEN");
        assertThat(registry.find("s1").orElseThrow().isAuthenticated()).isFalse();
    }

    @Test
    void pingIsAnsweredWithoutAuthentication() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        assertThat(lastReply().path("type").asText()).isEqualTo("pong");
    }

    @Test
    void malformedFramesGetInvalidMessage() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("not json"));
        assertThat(lastReply().path("data").path("code").asText()).isEqualTo("INVALID_MESSAGE");

        handler.handleMessage(session, new TextMessage("{\"token\":\"x\"}"));
        assertThat(lastReply().path("data").path("code").asText()).isEqualTo("INVALID_MESSAGE");
    }

    @Test
    void closeRemovesConnection() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(registry.find("s1")).isEmpty();
    }

    @Test
    @DisplayName("a second auth as a different user is refused and keeps the first identity and workspace")
    void reauthAsAnotherUserIsRefused() throws Exception {
        givenToken("token-8", 8L);
        givenToken("token-9", 9L);
        handler.afterConnectionEstablished(session);
        handler.handleMessage(session, new TextMessage("{\"type\":\"auth\",\"token\":\"token-8\"}"));
        handler.handleMessage(session, new TextMessage("{\"type\":\"workspace\",\"workspaceId\":12}"));

        handler.handleMessage(session, new TextMessage("{\"type\":\"auth\",\"token\":\"token-9\"}"));

        assertThat(lastReply().path("data").path("code").asText()).isEqualTo("IDENTITY_MISMATCH");
        ClientConnection connection = registry.find("s1").orElseThrow();
        assertThat(connection.getUserId()).isEqualTo(8L);
        assertThat(connection.getWorkspaceId()).isEqualTo(12L);

        handler.handleMessage(session, new TextMessage("{\"type\":\"auth\",\"token\":\"token-8\"}"));
        assertThat(lastReply().path("type").asText()).isEqualTo("ack");
    }

    @Test
    void subscribeBeyondTargetLimitIsRejected() throws Exception {
        attributes.put(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE, 5L);
        handler.afterConnectionEstablished(session);
        for (String id : List.of("1", "2", "3")) {
            handler.handleMessage(session, new TextMessage(
                    "{\"type\":\"subscribe\",\"targetType\":\"doc\",\"targetId\":\"" + id + "\"}"));
        }

        JsonNode reply = lastReply();
        assertThat(reply.path("type").asText()).isEqualTo("error");
        assertThat(reply.path("data").path("code").asText()).isEqualTo("TARGET_LIMIT_EXCEEDED");
        ClientConnection connection = registry.find("s1").orElseThrow();
        assertThat(connection.getActiveTargets()).hasSize(2);
        assertThat(connection.hasTarget(AnnotationTarget.of("doc", "3"))).isFalse();
    }

    @Test
    void presenceMessagesRequireAuthentication() throws Exception {
        handler.afterConnectionEstablished(session);

        for (String type : List.of("heartbeat", "update", "request_users")) {
            handler.handleMessage(session, new TextMessage("{\"type\":\"" + type + "\"}"));
            assertThat(lastReply().path("data").path("code").asText()).isEqualTo("AUTH_REQUIRED");
        }
    }

    @Test
    @DisplayName("update applies the reported status and request_users answers with workspace_update")
    void updateAndRequestUsers() throws Exception {
        attributes.put(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE, 5L);
        attributes.put(CollaborationHandshakeInterceptor.WORKSPACE_ID_ATTRIBUTE, 3L);
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage(
                "{\"type\":\"update\",\"presence\":{\"status\":\"busy\",\"currentPage\":\"/policies\"}}"));
        JsonNode update = lastReply();
        assertThat(update.path("type").asText()).isEqualTo("presence_update");
        assertThat(update.path("data").path("status").asText()).isEqualTo("busy");
        ClientConnection connection = registry.find("s1").orElseThrow();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.BUSY);

        handler.handleMessage(session, new TextMessage("{\"type\":\"request_users\"}"));
        JsonNode users = lastReply();
        assertThat(users.path("type").asText()).isEqualTo("workspace_update");
        assertThat(users.path("data").path("workspaceId").asLong()).isEqualTo(3L);
        assertThat(users.path("data").path("users").get(0).path("currentPage").asText()).isEqualTo("/policies");

        handler.handleMessage(session, new TextMessage(
                "{\"type\":\"update\",\"presence\":{\"status\":\"sleeping\"}}"));
        assertThat(lastReply().path("data").path("code").asText()).isEqualTo("INVALID_MESSAGE");
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.BUSY);
    }

    @Test
    @DisplayName("closing the socket tells the rest of the workspace the user left")
    void closeAnnouncesDisconnect() throws Exception {
        RecordingOutboundChannel peer = new RecordingOutboundChannel();
        registry.connect("peer", peer, 9L, 3L);
        attributes.put(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE, 5L);
        attributes.put(CollaborationHandshakeInterceptor.WORKSPACE_ID_ATTRIBUTE, 3L);
        handler.afterConnectionEstablished(session);
        assertThat(peer.awaitMessage(objectMapper, "user_connected", Duration.ofSeconds(1))).isNotNull();

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        JsonNode left = peer.awaitMessage(objectMapper, "user_disconnected", Duration.ofSeconds(1));
        assertThat(left).isNotNull();
        assertThat(left.path("data").path("userId").asLong()).isEqualTo(5L);
    }

    private void givenToken(String token, Long userId) {
        when(jwtTokenService.parseAccessToken(token)).thenReturn(new ParsedToken(
                userId, "user" + userId, List.of("USER"), OffsetDateTime.now(), OffsetDateTime.now().plusMinutes(5)
        ));
    }

    @SuppressWarnings("unchecked")
    private JsonNode lastReply() throws Exception {
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass((Class) WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<WebSocketMessage<?>> sent = captor.getAllValues();
        TextMessage last = (TextMessage) sent.get(sent.size() - 1);
        return objectMapper.readTree(last.getPayload());
    }
}
