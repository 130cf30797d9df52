package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.time.OffsetDateTime;

/**
 * A mention of the current user with its parent annotation and/or reply when they still exist.
 */
public record MentionResponse(
        Long id,
        Long annotationId,
        Long replyId,
        Long userId,
        Long mentionedBy,
        OffsetDateTime createdAt,
        AnnotationResponse annotation,
        ReplyResponse reply
) {
}
