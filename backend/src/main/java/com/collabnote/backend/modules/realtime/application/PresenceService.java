package com.collabnote.backend.modules.realtime.application;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.collabnote.backend.modules.realtime.domain.ClientConnection;
import com.collabnote.backend.modules.realtime.domain.ConnectionSelector;
import com.collabnote.backend.modules.realtime.domain.PresenceDetails;
import com.collabnote.backend.modules.realtime.domain.PresenceStatus;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Who is online in a workspace. Presence lives on the connections themselves; a user with several
 * connections is shown through the one seen most recently. Joins and leaves are announced per user,
 * not per connection.
 */
@Service
public class PresenceService {

    public static final String USER_CONNECTED = "user_connected";
    public static final String USER_DISCONNECTED = "user_disconnected";
    public static final String PRESENCE_UPDATE = "presence_update";
    public static final String WORKSPACE_UPDATE = "workspace_update";

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final ConnectionRegistry connectionRegistry;
    private final BroadcastRouter broadcastRouter;
    private final Duration awayAfter;
    private final Duration offlineAfter;

    public PresenceService(ConnectionRegistry connectionRegistry, BroadcastRouter broadcastRouter, RealtimeProperties properties) {
        this.connectionRegistry = connectionRegistry;
        this.broadcastRouter = broadcastRouter;
        this.awayAfter = properties.awayAfter();
        this.offlineAfter = properties.offlineAfter();
    }

    /**
     * Called once a connection is bound to a user, at open or on its first {@code auth}.
     */
    public void connectionOpened(ClientConnection connection) {
        if (!connection.isAuthenticated() || connection.getWorkspaceId() == null) {
            return;
        }
        announceJoin(connection, connection.getWorkspaceId());
        sendWorkspaceUsers(connection, connection.getWorkspaceId());
    }

    public void workspaceChanged(ClientConnection connection, Long previousWorkspaceId) {
        Long current = connection.getWorkspaceId();
        if (!connection.isAuthenticated() || Objects.equals(previousWorkspaceId, current)) {
            return;
        }
        if (previousWorkspaceId != null) {
            announceLeave(connection.getUserId(), previousWorkspaceId, connection.getConnectionId());
        }
        if (current != null) {
            announceJoin(connection, current);
            sendWorkspaceUsers(connection, current);
        }
    }

    /**
     * Called after the connection has been removed from the registry.
     */
    public void connectionClosed(ClientConnection connection) {
        if (connection.isAuthenticated() && connection.getWorkspaceId() != null) {
            announceLeave(connection.getUserId(), connection.getWorkspaceId(), connection.getConnectionId());
        }
    }

    public void heartbeat(ClientConnection connection) {
        if (connection.heartbeat()) {
            publishPresence(connection);
        }
    }

    public void update(ClientConnection connection, PresenceStatus status, PresenceDetails details) {
        connection.updatePresence(status, details);
        publishPresence(connection);
    }

    /**
     * Replies with the users of {@code workspaceId}, or of the connection's own workspace when it is
     * {@code null}. A connection without any workspace gets every connected user.
     */
    public void sendWorkspaceUsers(ClientConnection connection, Long workspaceId) {
        Long resolved = workspaceId != null ? workspaceId : connection.getWorkspaceId();
        ConnectionSelector selector = resolved != null
                ? new ConnectionSelector.ByWorkspace(resolved)
                : new ConnectionSelector.AllAuthenticated();
        List<PresenceView> users = usersOf(connectionRegistry.selectOpen(selector));
        broadcastRouter.send(connection, WORKSPACE_UPDATE, new WorkspaceUsers(resolved, users));
    }

    /**
     * Downgrades idle users and announces each change to their workspace.
     *
     * @return number of connections whose status changed
     */
    public int sweepInactive() {
        int changed = 0;
        for (ClientConnection connection : connectionRegistry.openConnections()) {
            if (connection.applyInactivity(awayAfter, offlineAfter)) {
                publishPresence(connection);
                changed++;
            }
        }
        if (changed > 0) {
            log.info("Presence sweep changed {} connections", changed);
        }
        return changed;
    }

    private void announceJoin(ClientConnection connection, Long workspaceId) {
        if (hasOtherConnection(connection.getUserId(), workspaceId, connection.getConnectionId())) {
            return;
        }
        broadcastRouter.sendToSelected(new ConnectionSelector.ByWorkspace(workspaceId), USER_CONNECTED,
                PresenceView.of(connection), connection.getConnectionId());
    }

    private void announceLeave(Long userId, Long workspaceId, String connectionId) {
        if (hasOtherConnection(userId, workspaceId, connectionId)) {
            return;
        }
        broadcastRouter.sendToSelected(new ConnectionSelector.ByWorkspace(workspaceId), USER_DISCONNECTED,
                new UserLeft(userId, workspaceId), connectionId);
        log.debug("User {} left workspace {}", userId, workspaceId);
    }

    private void publishPresence(ClientConnection connection) {
        Long workspaceId = connection.getWorkspaceId();
        if (workspaceId == null) {
            return;
        }
        broadcastRouter.sendToSelected(new ConnectionSelector.ByWorkspace(workspaceId), PRESENCE_UPDATE,
                PresenceView.of(connection), null);
    }

    private boolean hasOtherConnection(Long userId, Long workspaceId, String connectionId) {
        return connectionRegistry.selectOpen(new ConnectionSelector.ByWorkspace(workspaceId)).stream()
                .anyMatch(other -> userId.equals(other.getUserId()) && !other.getConnectionId().equals(connectionId));
    }

    private static List<PresenceView> usersOf(List<ClientConnection> connections) {
        Map<Long, ClientConnection> latestByUser = new LinkedHashMap<>();
        connections.stream()
                .filter(ClientConnection::isAuthenticated)
                .sorted(Comparator.comparing(ClientConnection::getLastSeenAt))
                .forEach(connection -> latestByUser.put(connection.getUserId(), connection));
        return latestByUser.values().stream()
                .map(PresenceView::of)
                .sorted(Comparator.comparing(PresenceView::userId))
                .toList();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PresenceView(
            Long userId,
            Long workspaceId,
            String status,
            String currentPage,
            String currentView,
            Map<String, Object> metadata,
            String lastSeen
    ) {

        static PresenceView of(ClientConnection connection) {
            PresenceDetails details = connection.getPresenceDetails();
            return new PresenceView(
                    connection.getUserId(),
                    connection.getWorkspaceId(),
                    connection.getPresenceStatus().wireName(),
                    details.currentPage(),
                    details.currentView(),
                    details.metadata(),
                    connection.getLastSeenAt().toString()
            );
        }
    }

    public record UserLeft(Long userId, Long workspaceId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WorkspaceUsers(Long workspaceId, List<PresenceView> users) {
    }
}
