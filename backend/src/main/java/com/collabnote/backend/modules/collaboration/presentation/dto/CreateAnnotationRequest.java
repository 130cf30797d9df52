package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateAnnotationRequest(
        @NotBlank @Size(max = 10000) String content,
        @NotBlank @Size(max = 255) String targetType,
        @NotBlank @Size(max = 255) String targetId,
        Map<String, Object> position,
        Map<String, Object> style,
        Long workspaceId,
        @JsonProperty("isPrivate") Boolean isPrivate,
        @Size(max = 50) List<@NotNull Long> mentionedUserIds
) {
}
