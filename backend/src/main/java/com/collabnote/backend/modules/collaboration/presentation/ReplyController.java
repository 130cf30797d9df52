package com.collabnote.backend.modules.collaboration.presentation;

import com.collabnote.backend.global.security.SecurityUtils;
import com.collabnote.backend.modules.collaboration.application.CollaborationService;
import com.collabnote.backend.modules.collaboration.presentation.dto.CollaborationDtoMapper;
import com.collabnote.backend.modules.collaboration.presentation.dto.ReplyResponse;
import com.collabnote.backend.modules.collaboration.presentation.dto.UpdateReplyRequest;

import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Replies")
@RestController
@RequestMapping("/replies")
public class ReplyController {

    private final CollaborationService collaborationService;

    public ReplyController(CollaborationService collaborationService) {
        this.collaborationService = collaborationService;
    }

    @PutMapping("/{replyId}")
    public ResponseEntity<ReplyResponse> updateReply(
            @PathVariable("replyId") Long replyId,
            @Valid @RequestBody UpdateReplyRequest request
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(CollaborationDtoMapper.toReplyResponse(
                collaborationService.updateReply(replyId, request.content(), userId)
        ));
    }

    @DeleteMapping("/{replyId}")
    public ResponseEntity<Void> deleteReply(@PathVariable("replyId") Long replyId) {
        collaborationService.deleteReply(replyId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
