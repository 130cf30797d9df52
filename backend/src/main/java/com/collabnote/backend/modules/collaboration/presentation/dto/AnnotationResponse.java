package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnnotationResponse(
        Long id,
        String content,
        String targetType,
        String targetId,
        Map<String, Object> position,
        Map<String, Object> style,
        Long workspaceId,
        Long creatorId,
        @JsonProperty("isPrivate") boolean isPrivate,
        @JsonProperty("isResolved") boolean isResolved,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
