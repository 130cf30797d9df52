package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateReplyRequest(
        @NotBlank @Size(max = 10000) String content,
        @Size(max = 50) List<@NotNull Long> mentionedUserIds
) {
}
