package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.time.OffsetDateTime;

public record ReplyResponse(
        Long id,
        Long annotationId,
        String content,
        Long userId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
