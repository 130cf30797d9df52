package com.collabnote.backend.modules.realtime.infrastructure.websocket;

import java.util.Optional;

import com.collabnote.backend.modules.auth.application.JwtTokenService;
import com.collabnote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.collabnote.backend.modules.collaboration.domain.AnnotationTarget;
import com.collabnote.backend.modules.realtime.application.BroadcastRouter;
import com.collabnote.backend.modules.realtime.application.ConnectionRegistry;
import com.collabnote.backend.modules.realtime.application.PresenceService;
import com.collabnote.backend.modules.realtime.application.RealtimeProperties;
import com.collabnote.backend.modules.realtime.domain.ClientConnection;
import com.collabnote.backend.modules.realtime.domain.PresenceDetails;
import com.collabnote.backend.modules.realtime.domain.PresenceStatus;
import com.collabnote.backend.modules.realtime.domain.TargetLimitExceededException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Binds WebSocket sessions to registry connections and applies client control messages to them.
 * Every reply goes through the connection's outbound queue so it is ordered with broadcasts.
 */
@Component
public class CollaborationWebSocketHandler extends TextWebSocketHandler {

    static final String ACK = "ack";
    static final String PONG = "pong";
    static final String ERROR = "error";

    private static final Logger log = LoggerFactory.getLogger(CollaborationWebSocketHandler.class);

    private final ConnectionRegistry connectionRegistry;
    private final BroadcastRouter broadcastRouter;
    private final PresenceService presenceService;
    private final JwtTokenService jwtTokenService;
    private final ObjectMapper objectMapper;
    private final RealtimeProperties properties;

    public CollaborationWebSocketHandler(
            ConnectionRegistry connectionRegistry,
            BroadcastRouter broadcastRouter,
            PresenceService presenceService,
            JwtTokenService jwtTokenService,
            ObjectMapper objectMapper,
            RealtimeProperties properties
    ) {
        this.connectionRegistry = connectionRegistry;
        this.broadcastRouter = broadcastRouter;
        this.presenceService = presenceService;
        this.jwtTokenService = jwtTokenService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Long userId = (Long) session.getAttributes().get(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE);
        Long workspaceId = (Long) session.getAttributes().get(CollaborationHandshakeInterceptor.WORKSPACE_ID_ATTRIBUTE);
        WebSocketOutboundChannel channel = new WebSocketOutboundChannel(
                session, properties.sendTimeLimit(), properties.sendBufferSizeLimit());
        ClientConnection connection = connectionRegistry.connect(session.getId(), channel, userId, workspaceId);
        presenceService.connectionOpened(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<ClientConnection> found = connectionRegistry.find(session.getId());
        if (found.isEmpty() || !found.get().isOpen()) {
            return;
        }
        ClientConnection connection = found.get();

        ClientControlMessage control;
        try {
            control = objectMapper.readValue(message.getPayload(), ClientControlMessage.class);
        } catch (JsonProcessingException ex) {
            sendError(connection, "INVALID_MESSAGE", "Message is not valid JSON");
            return;
        }
        if (control == null || !StringUtils.hasText(control.type())) {
            sendError(connection, "INVALID_MESSAGE", "Message type is required");
            return;
        }
        handleControl(connection, control);
    }

    void handleControl(ClientConnection connection, ClientControlMessage control) {
        switch (control.type()) {
            case "ping" -> broadcastRouter.send(connection, PONG, null);
            case "auth" -> authenticate(connection, control.token());
            case "subscribe", "unsubscribe", "workspace" -> {
                if (requireAuthenticated(connection, control)) {
                    applyInterest(connection, control);
                }
            }
            case "heartbeat" -> {
                if (requireAuthenticated(connection, control)) {
                    presenceService.heartbeat(connection);
                }
            }
            case "update" -> {
                if (requireAuthenticated(connection, control)) {
                    updatePresence(connection, control.presence());
                }
            }
            case "request_users" -> {
                if (requireAuthenticated(connection, control)) {
                    presenceService.sendWorkspaceUsers(connection, control.workspaceId());
                }
            }
            default -> sendError(connection, "UNKNOWN_MESSAGE_TYPE", "Unsupported message type: " + control.type());
        }
    }

    private boolean requireAuthenticated(ClientConnection connection, ClientControlMessage control) {
        if (connection.isAuthenticated()) {
            return true;
        }
        sendError(connection, "AUTH_REQUIRED", "Authenticate before sending " + control.type());
        return false;
    }

    private void authenticate(ClientConnection connection, String token) {
        if (!StringUtils.hasText(token)) {
            sendError(connection, "INVALID_MESSAGE", "token is required");
            return;
        }
        try {
            Long userId = jwtTokenService.parseAccessToken(token).userId();
            boolean firstAuth = !connection.isAuthenticated();
            if (!connection.authenticate(userId)) {
                sendError(connection, "IDENTITY_MISMATCH", "Connection is already authenticated as another user");
                return;
            }
            broadcastRouter.send(connection, ACK, ControlAck.authenticated(userId));
            if (firstAuth) {
                presenceService.connectionOpened(connection);
            }
        } catch (InvalidTokenException ex) {
            sendError(connection, "INVALID_TOKEN", "Access token is invalid or expired");
        }
    }

    private void applyInterest(ClientConnection connection, ClientControlMessage control) {
        if ("workspace".equals(control.type())) {
            Long previous = connection.getWorkspaceId();
            connection.updateWorkspace(control.workspaceId());
            broadcastRouter.send(connection, ACK, ControlAck.workspace(control.workspaceId()));
            presenceService.workspaceChanged(connection, previous);
            return;
        }
        if (!StringUtils.hasText(control.targetType()) || !StringUtils.hasText(control.targetId())) {
            sendError(connection, "INVALID_MESSAGE", "targetType and targetId are required");
            return;
        }
        AnnotationTarget target = AnnotationTarget.of(control.targetType(), control.targetId());
        if ("subscribe".equals(control.type())) {
            try {
                connection.addTarget(target);
            } catch (TargetLimitExceededException ex) {
                sendError(connection, "TARGET_LIMIT_EXCEEDED",
                        "A connection may follow at most " + ex.getLimit() + " targets");
                return;
            }
        } else {
            connection.removeTarget(target);
        }
        broadcastRouter.send(connection, ACK, ControlAck.target(control.type(), target));
    }

    private void updatePresence(ClientConnection connection, ClientControlMessage.PresencePatch patch) {
        if (patch == null) {
            sendError(connection, "INVALID_MESSAGE", "presence is required");
            return;
        }
        PresenceStatus status = null;
        if (patch.status() != null) {
            Optional<PresenceStatus> parsed = PresenceStatus.fromWireName(patch.status());
            if (parsed.isEmpty()) {
                sendError(connection, "INVALID_MESSAGE", "Unknown presence status: " + patch.status());
                return;
            }
            status = parsed.get();
        }
        presenceService.update(connection, status,
                new PresenceDetails(patch.currentPage(), patch.currentView(), patch.metadata()));
    }

    private void sendError(ClientConnection connection, String code, String message) {
        broadcastRouter.send(connection, ERROR, new ControlError(code, message));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        connectionRegistry.unregister(session.getId()).ifPresent(presenceService::connectionClosed);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionRegistry.unregister(session.getId()).ifPresent(presenceService::connectionClosed);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ControlAck(String action, Long userId, String targetType, String targetId, Long workspaceId) {

        static ControlAck authenticated(Long userId) {
            return new ControlAck("auth", userId, null, null, null);
        }

        static ControlAck target(String action, AnnotationTarget target) {
            return new ControlAck(action, null, target.type(), target.id(), null);
        }

        static ControlAck workspace(Long workspaceId) {
            return new ControlAck("workspace", null, null, null, workspaceId);
        }
    }

    record ControlError(String code, String message) {
    }
}
