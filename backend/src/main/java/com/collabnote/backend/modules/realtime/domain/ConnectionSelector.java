package com.collabnote.backend.modules.realtime.domain;

import java.util.Objects;

import com.collabnote.backend.modules.collaboration.application.event.CollaborationEvent;
import com.collabnote.backend.modules.collaboration.domain.AnnotationTarget;

import org.springframework.util.StringUtils;

/**
 * Which open connections an event is addressed to.
 */
public sealed interface ConnectionSelector {

    boolean matches(ClientConnection connection);

    /**
     * Workspace takes precedence over target; an event with neither goes to every authenticated client.
     */
    static ConnectionSelector forEvent(CollaborationEvent event) {
        if (event.workspaceId() != null) {
            return new ByWorkspace(event.workspaceId());
        }
        if (StringUtils.hasText(event.targetType()) && StringUtils.hasText(event.targetId())) {
            return new ByTarget(AnnotationTarget.of(event.targetType(), event.targetId()));
        }
        return new AllAuthenticated();
    }

    record AllAuthenticated() implements ConnectionSelector {
        @Override
        public boolean matches(ClientConnection connection) {
            return connection.isAuthenticated();
        }
    }

    record ByWorkspace(Long workspaceId) implements ConnectionSelector {

        public ByWorkspace {
            Objects.requireNonNull(workspaceId, "workspaceId");
        }

        @Override
        public boolean matches(ClientConnection connection) {
            return workspaceId.equals(connection.getWorkspaceId());
        }
    }

    record ByTarget(AnnotationTarget target) implements ConnectionSelector {

        public ByTarget {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public boolean matches(ClientConnection connection) {
            return connection.hasTarget(target);
        }
    }
}
