package com.collabnote.backend.modules.realtime.domain;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.collabnote.backend.modules.collaboration.domain.AnnotationTarget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live client and the interest it has declared.
 * <p>
 * Attribute mutations and {@link #enqueue(String)} are serialized on the connection's monitor, so a
 * message is never queued on a connection that has already closed. Readers see attributes through
 * volatile fields and a concurrent target set without taking the lock. Queued messages are written by
 * a single drain task at a time on the delivery executor, preserving per-connection order.
 * <p>
 * Authenticated connections also carry the user's presence: a status, what the client reported about
 * itself, and when it was last active.
 */
public class ClientConnection {

    public static final int DEFAULT_MAX_TARGETS = 100;

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);
    private static final long NOT_SENDING = -1L;

    private final String connectionId;
    private final OutboundChannel channel;
    private final Executor deliveryExecutor;
    private final int maxPendingMessages;
    private final int maxTargets;
    private final Clock clock;

    private final Set<AnnotationTarget> activeTargets = ConcurrentHashMap.newKeySet();
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile Long userId;
    private volatile Long workspaceId;
    private volatile PresenceStatus presenceStatus = PresenceStatus.ONLINE;
    private volatile PresenceDetails presenceDetails = PresenceDetails.EMPTY;
    private volatile Instant lastSeenAt;
    private volatile long sendStartedAtMillis = NOT_SENDING;

    public ClientConnection(String connectionId, OutboundChannel channel, Executor deliveryExecutor, int maxPendingMessages) {
        this(connectionId, channel, deliveryExecutor, maxPendingMessages, DEFAULT_MAX_TARGETS, Clock.systemUTC());
    }

    public ClientConnection(
            String connectionId,
            OutboundChannel channel,
            Executor deliveryExecutor,
            int maxPendingMessages,
            int maxTargets,
            Clock clock
    ) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxPendingMessages < 1) {
            throw new IllegalArgumentException("maxPendingMessages must be >= 1");
        }
        if (maxTargets < 1) {
            throw new IllegalArgumentException("maxTargets must be >= 1");
        }
        this.maxPendingMessages = maxPendingMessages;
        this.maxTargets = maxTargets;
        this.lastSeenAt = clock.instant();
    }

    /**
     * Moves a connecting client to {@link ConnectionState#OPEN} with the identity resolved at handshake.
     */
    public synchronized void open(Long userId, Long workspaceId) {
        if (state != ConnectionState.CONNECTING) {
            throw new IllegalStateException("Connection " + connectionId + " is " + state);
        }
        this.userId = userId;
        this.workspaceId = workspaceId;
        this.lastSeenAt = clock.instant();
        this.state = ConnectionState.OPEN;
    }

    /**
     * Binds the connection to {@code userId}. Re-authenticating as the same user is allowed; switching to
     * another user is refused and returns {@code false}, leaving the connection unchanged.
     */
    public synchronized boolean authenticate(Long userId) {
        requireOpen();
        Objects.requireNonNull(userId, "userId");
        if (this.userId != null && !this.userId.equals(userId)) {
            return false;
        }
        this.userId = userId;
        this.lastSeenAt = clock.instant();
        return true;
    }

    public synchronized void updateWorkspace(Long workspaceId) {
        requireOpen();
        this.workspaceId = workspaceId;
    }

    /**
     * @throws TargetLimitExceededException when a new target would exceed the per-connection limit
     */
    public synchronized boolean addTarget(AnnotationTarget target) {
        requireOpen();
        if (!activeTargets.contains(target) && activeTargets.size() >= maxTargets) {
            throw new TargetLimitExceededException(connectionId, maxTargets);
        }
        return activeTargets.add(target);
    }

    public synchronized boolean removeTarget(AnnotationTarget target) {
        requireOpen();
        return activeTargets.remove(target);
    }

    /**
     * Queues a serialized message and returns immediately. Returns {@code false} when the connection is
     * not open or its queue is full; the message is dropped for this connection only.
     */
    public synchronized boolean enqueue(String payload) {
        if (state != ConnectionState.OPEN) {
            return false;
        }
        if (pendingCount.incrementAndGet() > maxPendingMessages) {
            pendingCount.decrementAndGet();
            log.warn("Outbound queue full for connection {}, dropping message", connectionId);
            return false;
        }
        pending.add(payload);
        scheduleDrain();
        return true;
    }

    /**
     * Records activity. Returns {@code true} when this brought an idle user back {@link PresenceStatus#ONLINE}.
     */
    public synchronized boolean heartbeat() {
        requireOpen();
        lastSeenAt = clock.instant();
        if (presenceStatus == PresenceStatus.AWAY || presenceStatus == PresenceStatus.OFFLINE) {
            presenceStatus = PresenceStatus.ONLINE;
            return true;
        }
        return false;
    }

    /**
     * Applies a client-reported presence change; {@code null} arguments keep the current values.
     */
    public synchronized void updatePresence(PresenceStatus status, PresenceDetails details) {
        requireOpen();
        if (status != null) {
            presenceStatus = status;
        }
        presenceDetails = presenceDetails.merge(details);
        lastSeenAt = clock.instant();
    }

    /**
     * Downgrades an idle user: {@code ONLINE} becomes {@code AWAY} after {@code awayAfter}, anything but
     * {@code OFFLINE} becomes {@code OFFLINE} after {@code offlineAfter}. Returns {@code true} on a change.
     */
    public synchronized boolean applyInactivity(Duration awayAfter, Duration offlineAfter) {
        if (state != ConnectionState.OPEN || userId == null) {
            return false;
        }
        Duration idle = Duration.between(lastSeenAt, clock.instant());
        if (idle.compareTo(offlineAfter) > 0 && presenceStatus != PresenceStatus.OFFLINE) {
            presenceStatus = PresenceStatus.OFFLINE;
            return true;
        }
        if (idle.compareTo(awayAfter) > 0 && presenceStatus == PresenceStatus.ONLINE) {
            presenceStatus = PresenceStatus.AWAY;
            return true;
        }
        return false;
    }

    /**
     * Whether a write to the transport has been in progress for at least {@code limit}.
     */
    public boolean isSendStalled(Duration limit) {
        long startedAt = sendStartedAtMillis;
        return startedAt != NOT_SENDING && clock.millis() - startedAt >= limit.toMillis();
    }

    /**
     * Closes the connection and the transport under it, releasing a write blocked on a stalled client.
     */
    public void terminate() {
        close();
        try {
            channel.close();
        } catch (IOException ex) {
            log.warn("Failed to close transport of connection {}: {}", connectionId, ex.getMessage());
        }
    }

    public synchronized void close() {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        state = ConnectionState.CLOSED;
        activeTargets.clear();
        while (pending.poll() != null) {
            pendingCount.decrementAndGet();
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            draining.set(false);
            log.warn("Delivery executor rejected drain for connection {}", connectionId);
        }
    }

    private void drain() {
        try {
            String payload;
            while ((payload = pending.poll()) != null) {
                pendingCount.decrementAndGet();
                if (state != ConnectionState.OPEN || !channel.isOpen()) {
                    continue;
                }
                sendStartedAtMillis = clock.millis();
                try {
                    channel.send(payload);
                } catch (IOException | RuntimeException ex) {
                    log.warn("Send failed on connection {}: {}", connectionId, ex.getMessage());
                } finally {
                    sendStartedAtMillis = NOT_SENDING;
                }
            }
        } finally {
            draining.set(false);
        }
        // a message may have arrived between the last poll and releasing the flag
        if (!pending.isEmpty() && state == ConnectionState.OPEN) {
            scheduleDrain();
        }
    }

    private void requireOpen() {
        if (state != ConnectionState.OPEN) {
            throw new IllegalStateException("Connection " + connectionId + " is " + state);
        }
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    public boolean hasTarget(AnnotationTarget target) {
        return activeTargets.contains(target);
    }

    public Set<AnnotationTarget> getActiveTargets() {
        return Set.copyOf(activeTargets);
    }

    public String getConnectionId() {
        return connectionId;
    }

    public ConnectionState getState() {
        return state;
    }

    public Long getUserId() {
        return userId;
    }

    public Long getWorkspaceId() {
        return workspaceId;
    }

    public int getPendingCount() {
        return pendingCount.get();
    }

    public PresenceStatus getPresenceStatus() {
        return presenceStatus;
    }

    public PresenceDetails getPresenceDetails() {
        return presenceDetails;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }
}
