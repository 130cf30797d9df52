package com.collabnote.backend.modules.collaboration.presentation;

import java.util.List;

import com.collabnote.backend.global.security.SecurityUtils;
import com.collabnote.backend.modules.collaboration.application.CollaborationService;
import com.collabnote.backend.modules.collaboration.application.CollaborationService.MentionView;
import com.collabnote.backend.modules.collaboration.presentation.dto.CollaborationDtoMapper;
import com.collabnote.backend.modules.collaboration.presentation.dto.MentionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Mentions")
@RestController
@RequestMapping("/mentions")
public class MentionController {

    private final CollaborationService collaborationService;

    public MentionController(CollaborationService collaborationService) {
        this.collaborationService = collaborationService;
    }

    @Operation(summary = "Mentions of the current user, newest first")
    @GetMapping
    public ResponseEntity<List<MentionResponse>> getMentions() {
        Long userId = SecurityUtils.getCurrentUserId();
        List<MentionResponse> mentions = collaborationService.getUserMentions(userId).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(mentions);
    }

    private MentionResponse toResponse(MentionView view) {
        return CollaborationDtoMapper.toMentionResponse(view.mention(), view.annotation(), view.reply());
    }
}
