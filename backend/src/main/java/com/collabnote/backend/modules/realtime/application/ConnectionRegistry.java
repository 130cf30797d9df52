package com.collabnote.backend.modules.realtime.application;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import com.collabnote.backend.modules.realtime.domain.ClientConnection;
import com.collabnote.backend.modules.realtime.domain.ConnectionSelector;
import com.collabnote.backend.modules.realtime.domain.OutboundChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Live client connections keyed by connection id. Closed connections are removed and never selected.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Executor deliveryExecutor;
    private final int maxPendingMessages;
    private final int maxTargets;
    private final Clock clock;

    public ConnectionRegistry(
            @Qualifier(RealtimeDeliveryConfig.DELIVERY_EXECUTOR) Executor deliveryExecutor,
            RealtimeProperties properties,
            Clock clock
    ) {
        this.deliveryExecutor = deliveryExecutor;
        this.maxPendingMessages = properties.maxPendingMessages();
        this.maxTargets = properties.maxTargets();
        this.clock = clock;
    }

    public ClientConnection register(String connectionId, OutboundChannel channel) {
        ClientConnection connection = new ClientConnection(
                connectionId, channel, deliveryExecutor, maxPendingMessages, maxTargets, clock);
        ClientConnection existing = connections.putIfAbsent(connectionId, connection);
        if (existing != null) {
            throw new IllegalStateException("Connection " + connectionId + " already registered");
        }
        return connection;
    }

    public ClientConnection open(String connectionId, Long userId, Long workspaceId) {
        ClientConnection connection = find(connectionId)
                .orElseThrow(() -> new IllegalStateException("Connection " + connectionId + " is not registered"));
        connection.open(userId, workspaceId);
        log.info("Connection {} opened (user={}, workspace={})", connectionId, userId, workspaceId);
        return connection;
    }

    /**
     * Registers and opens in one step.
     */
    public ClientConnection connect(String connectionId, OutboundChannel channel, Long userId, Long workspaceId) {
        register(connectionId, channel);
        return open(connectionId, userId, workspaceId);
    }

    public Optional<ClientConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * @return the removed connection, empty when it was already gone
     */
    public Optional<ClientConnection> unregister(String connectionId) {
        ClientConnection removed = connections.remove(connectionId);
        if (removed != null) {
            removed.close();
            log.info("Connection {} closed", connectionId);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Removes connections whose current write has been blocked for at least {@code sendTimeLimit} and
     * closes their transport.
     *
     * @return the connections removed
     */
    public List<ClientConnection> closeStalled(Duration sendTimeLimit) {
        List<ClientConnection> stalled = connections.values().stream()
                .filter(connection -> connection.isSendStalled(sendTimeLimit))
                .toList();
        for (ClientConnection connection : stalled) {
            connections.remove(connection.getConnectionId(), connection);
            connection.terminate();
            log.warn("Connection {} dropped: send blocked for more than {}", connection.getConnectionId(), sendTimeLimit);
        }
        return stalled;
    }

    public List<ClientConnection> openConnections() {
        return connections.values().stream()
                .filter(ClientConnection::isOpen)
                .toList();
    }

    public List<ClientConnection> selectOpen(ConnectionSelector selector) {
        return connections.values().stream()
                .filter(ClientConnection::isOpen)
                .filter(selector::matches)
                .toList();
    }

    public int openCount() {
        return (int) connections.values().stream()
                .filter(ClientConnection::isOpen)
                .count();
    }
}
