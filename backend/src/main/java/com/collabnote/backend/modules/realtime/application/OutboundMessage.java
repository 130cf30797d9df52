package com.collabnote.backend.modules.realtime.application;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire envelope for everything sent to clients.
 *
 * @param timestamp ISO-8601 instant the message was built
 */
public record OutboundMessage(String type, Object data, String timestamp) {

    /**
     * {@code data} of broadcast messages: the event context plus the entity payload.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EventData(
            Long userId,
            Long workspaceId,
            String targetType,
            String targetId,
            Long annotationId,
            Long replyId,
            Long mentionedUserId,
            Object data
    ) {
    }
}
