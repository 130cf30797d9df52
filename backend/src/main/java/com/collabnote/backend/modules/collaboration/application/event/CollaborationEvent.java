package com.collabnote.backend.modules.collaboration.application.event;

import java.util.Objects;

/**
 * Domain event emitted after a collaboration write commits.
 *
 * @param restrictedToUserId set when the event concerns a private annotation; only that user's
 *                           connections may receive it
 * @param excludedUserId     connections of this user never receive the event
 */
public record CollaborationEvent(
        CollaborationEventType type,
        Long userId,
        Long workspaceId,
        String targetType,
        String targetId,
        Long annotationId,
        Long replyId,
        Long mentionedUserId,
        Long restrictedToUserId,
        Long excludedUserId,
        Object data
) {

    public CollaborationEvent {
        Objects.requireNonNull(type, "type");
    }

    public static Builder builder(CollaborationEventType type) {
        return new Builder(type);
    }

    public static final class Builder {

        private final CollaborationEventType type;
        private Long userId;
        private Long workspaceId;
        private String targetType;
        private String targetId;
        private Long annotationId;
        private Long replyId;
        private Long mentionedUserId;
        private Long restrictedToUserId;
        private Long excludedUserId;
        private Object data;

        private Builder(CollaborationEventType type) {
            this.type = type;
        }

        public Builder userId(Long userId) {
            this.userId = userId;
            return this;
        }

        public Builder workspaceId(Long workspaceId) {
            this.workspaceId = workspaceId;
            return this;
        }

        public Builder target(String targetType, String targetId) {
            this.targetType = targetType;
            this.targetId = targetId;
            return this;
        }

        public Builder annotationId(Long annotationId) {
            this.annotationId = annotationId;
            return this;
        }

        public Builder replyId(Long replyId) {
            this.replyId = replyId;
            return this;
        }

        public Builder mentionedUserId(Long mentionedUserId) {
            this.mentionedUserId = mentionedUserId;
            return this;
        }

        public Builder restrictedTo(Long restrictedToUserId) {
            this.restrictedToUserId = restrictedToUserId;
            return this;
        }

        public Builder excluding(Long excludedUserId) {
            this.excludedUserId = excludedUserId;
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public CollaborationEvent build() {
            return new CollaborationEvent(
                    type,
                    userId,
                    workspaceId,
                    targetType,
                    targetId,
                    annotationId,
                    replyId,
                    mentionedUserId,
                    restrictedToUserId,
                    excludedUserId,
                    data
            );
        }
    }
}
