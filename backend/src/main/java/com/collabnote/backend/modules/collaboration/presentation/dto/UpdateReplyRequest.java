package com.collabnote.backend.modules.collaboration.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateReplyRequest(
        @NotBlank @Size(max = 10000) String content
) {
}
