package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left untouched.
 */
public record UpdateAnnotationRequest(
        @Size(max = 10000) String content,
        @JsonProperty("isPrivate") Boolean isPrivate,
        @JsonProperty("isResolved") Boolean isResolved,
        Map<String, Object> position,
        Map<String, Object> style
) {
}
