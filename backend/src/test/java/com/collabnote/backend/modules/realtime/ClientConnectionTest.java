package com.collabnote.backend.modules.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import com.collabnote.backend.modules.collaboration.domain.AnnotationTarget;
import com.collabnote.backend.modules.realtime.domain.ClientConnection;
import com.collabnote.backend.modules.realtime.domain.ConnectionState;
import com.collabnote.backend.modules.realtime.domain.OutboundChannel;
import com.collabnote.backend.modules.realtime.domain.PresenceDetails;
import com.collabnote.backend.modules.realtime.domain.PresenceStatus;
import com.collabnote.backend.modules.realtime.domain.TargetLimitExceededException;
import com.collabnote.backend.support.MutableClock;
import com.collabnote.backend.support.RecordingOutboundChannel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClientConnectionTest {

    @Test
    void followsConnectingOpenClosedLifecycle() {
        ClientConnection connection = new ClientConnection("c1", new RecordingOutboundChannel(), Runnable::run, 4);
        assertThat(connection.getState()).isEqualTo(ConnectionState.CONNECTING);
        assertThat(connection.enqueue("early")).isFalse();

        connection.open(7L, 3L);
        assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
        assertThat(connection.isAuthenticated()).isTrue();
        assertThat(connection.getWorkspaceId()).isEqualTo(3L);

        connection.close();
        assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(connection.enqueue("late")).isFalse();
        assertThatThrownBy(() -> connection.open(7L, null)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> connection.addTarget(AnnotationTarget.of("doc", "1")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deliversInEnqueueOrder() {
        RecordingOutboundChannel channel = new RecordingOutboundChannel();
        ClientConnection connection = new ClientConnection("c2", channel, Runnable::run, 8);
        connection.open(1L, null);

        connection.enqueue("a");
        connection.enqueue("b");
        connection.enqueue("c");

        assertThat(channel.drainSent()).containsExactly("a", "b", "c");
        assertThat(connection.getPendingCount()).isZero();
    }

    @Test
    void dropsMessagesBeyondQueueBound() {
        List<Runnable> scheduled = new ArrayList<>();
        Executor parked = scheduled::add;
        RecordingOutboundChannel channel = new RecordingOutboundChannel();
        ClientConnection connection = new ClientConnection("c3", channel, parked, 2);
        connection.open(1L, null);

        assertThat(connection.enqueue("1")).isTrue();
        assertThat(connection.enqueue("2")).isTrue();
        assertThat(connection.enqueue("3")).isFalse();
        assertThat(scheduled).hasSize(1);

        scheduled.get(0).run();
        assertThat(channel.drainSent()).containsExactly("1", "2");
    }

    @Test
    void sendFailureDoesNotStopLaterMessages() {
        List<String> delivered = new ArrayList<>();
        OutboundChannel flaky = new OutboundChannel() {
            @Override
            public void send(String payload) throws IOException {
                if (payload.equals("bad")) {
                    throw new IOException("broken pipe");
                }
                delivered.add(payload);
            }

            @Override
            public boolean isOpen() {
                return true;
            }
        };
        ClientConnection connection = new ClientConnection("c4", flaky, Runnable::run, 8);
        connection.open(1L, null);

        connection.enqueue("bad");
        connection.enqueue("good");

        assertThat(delivered).containsExactly("good");
    }

    @Test
    void targetsAreTrackedAsASet() {
        ClientConnection connection = new ClientConnection("c5", new RecordingOutboundChannel(), Runnable::run, 8);
        connection.open(1L, null);

        assertThat(connection.addTarget(AnnotationTarget.of("policy", "42"))).isTrue();
        assertThat(connection.addTarget(AnnotationTarget.of("policy", "42"))).isFalse();
        assertThat(connection.hasTarget(AnnotationTarget.of("policy", "42"))).isTrue();
        assertThat(connection.removeTarget(AnnotationTarget.of("policy", "42"))).isTrue();
        assertThat(connection.getActiveTargets()).isEmpty();
    }

    @Test
    @DisplayName("a connection bound to one user cannot be re-authenticated as another")
    void reauthenticationAsAnotherUserIsRefused() {
        ClientConnection connection = new ClientConnection("c6", new RecordingOutboundChannel(), Runnable::run, 8);
        connection.open(null, null);

        assertThat(connection.authenticate(1L)).isTrue();
        connection.updateWorkspace(12L);
        assertThat(connection.authenticate(1L)).isTrue();
        assertThat(connection.authenticate(2L)).isFalse();

        assertThat(connection.getUserId()).isEqualTo(1L);
        assertThat(connection.getWorkspaceId()).isEqualTo(12L);
    }

    @Test
    void targetsAreCappedPerConnection() {
        ClientConnection connection = new ClientConnection(
                "c7", new RecordingOutboundChannel(), Runnable::run, 8, 2, new MutableClock(Instant.EPOCH));
        connection.open(1L, null);
        connection.addTarget(AnnotationTarget.of("doc", "1"));
        connection.addTarget(AnnotationTarget.of("doc", "2"));

        assertThat(connection.addTarget(AnnotationTarget.of("doc", "2"))).isFalse();
        assertThatThrownBy(() -> connection.addTarget(AnnotationTarget.of("doc", "3")))
                .isInstanceOfSatisfying(TargetLimitExceededException.class,
                        ex -> assertThat(ex.getLimit()).isEqualTo(2));
        assertThat(connection.getActiveTargets()).hasSize(2);
    }

    @Test
    @DisplayName("idle users go away, then offline, and a heartbeat brings them back online")
    void inactivityDowngradesPresenceUntilHeartbeat() {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
        ClientConnection connection = new ClientConnection(
                "c8", new RecordingOutboundChannel(), Runnable::run, 8, 10, clock);
        connection.open(1L, 12L);
        Duration awayAfter = Duration.ofMinutes(2);
        Duration offlineAfter = Duration.ofMinutes(5);

        clock.advance(Duration.ofMinutes(1));
        assertThat(connection.applyInactivity(awayAfter, offlineAfter)).isFalse();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.ONLINE);

        clock.advance(Duration.ofMinutes(2));
        assertThat(connection.applyInactivity(awayAfter, offlineAfter)).isTrue();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.AWAY);
        assertThat(connection.applyInactivity(awayAfter, offlineAfter)).isFalse();

        clock.advance(Duration.ofMinutes(3));
        assertThat(connection.applyInactivity(awayAfter, offlineAfter)).isTrue();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.OFFLINE);

        assertThat(connection.heartbeat()).isTrue();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.ONLINE);
        assertThat(connection.getLastSeenAt()).isEqualTo(clock.instant());
        assertThat(connection.heartbeat()).isFalse();
    }

    @Test
    void busyIsKeptByHeartbeatButNotByLongInactivity() {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
        ClientConnection connection = new ClientConnection(
                "c9", new RecordingOutboundChannel(), Runnable::run, 8, 10, clock);
        connection.open(1L, 12L);

        connection.updatePresence(PresenceStatus.BUSY, new PresenceDetails("/policies", "grid", null));
        connection.updatePresence(null, new PresenceDetails(null, "detail", null));
        assertThat(connection.heartbeat()).isFalse();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.BUSY);
        assertThat(connection.getPresenceDetails().currentPage()).isEqualTo("/policies");
        assertThat(connection.getPresenceDetails().currentView()).isEqualTo("detail");

        clock.advance(Duration.ofMinutes(3));
        assertThat(connection.applyInactivity(Duration.ofMinutes(2), Duration.ofMinutes(5))).isFalse();
        clock.advance(Duration.ofMinutes(3));
        assertThat(connection.applyInactivity(Duration.ofMinutes(2), Duration.ofMinutes(5))).isTrue();
        assertThat(connection.getPresenceStatus()).isEqualTo(PresenceStatus.OFFLINE);
    }
}
