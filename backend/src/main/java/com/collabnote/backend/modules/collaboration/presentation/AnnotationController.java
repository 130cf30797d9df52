package com.collabnote.backend.modules.collaboration.presentation;

import java.util.List;

import com.collabnote.backend.global.security.SecurityUtils;
import com.collabnote.backend.modules.collaboration.application.CollaborationService;
import com.collabnote.backend.modules.collaboration.application.CollaborationService.AnnotationPatch;
import com.collabnote.backend.modules.collaboration.application.CollaborationService.NewAnnotation;
import com.collabnote.backend.modules.collaboration.domain.Annotation;
import com.collabnote.backend.modules.collaboration.presentation.dto.AnnotationResponse;
import com.collabnote.backend.modules.collaboration.presentation.dto.CollaborationDtoMapper;
import com.collabnote.backend.modules.collaboration.presentation.dto.CreateAnnotationRequest;
import com.collabnote.backend.modules.collaboration.presentation.dto.CreateReplyRequest;
import com.collabnote.backend.modules.collaboration.presentation.dto.ReplyResponse;
import com.collabnote.backend.modules.collaboration.presentation.dto.UpdateAnnotationRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Annotations")
@RestController
@RequestMapping("/annotations")
public class AnnotationController {

    private final CollaborationService collaborationService;

    public AnnotationController(CollaborationService collaborationService) {
        this.collaborationService = collaborationService;
    }

    @Operation(
            summary = "Create an annotation",
            description = """
                    Attaches an annotation to `(targetType, targetId)` on behalf of the current user. \
                    Users listed in `mentionedUserIds` receive a mention.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Annotation created"),
            @ApiResponse(responseCode = "400", description = "content, targetType or targetId blank")
    })
    @PostMapping
    public ResponseEntity<AnnotationResponse> createAnnotation(@Valid @RequestBody CreateAnnotationRequest request) {
        Long userId = SecurityUtils.getCurrentUserId();
        Annotation created = collaborationService.createAnnotation(
                new NewAnnotation(
                        request.content(),
                        request.targetType(),
                        request.targetId(),
                        request.position(),
                        request.style(),
                        request.workspaceId(),
                        request.isPrivate(),
                        request.mentionedUserIds()
                ),
                userId
        );
        return ResponseEntity.status(201).body(CollaborationDtoMapper.toAnnotationResponse(created));
    }

    @Operation(summary = "List annotations on a target", description = "Private annotations of other users are omitted.")
    @GetMapping
    public ResponseEntity<List<AnnotationResponse>> getAnnotations(
            @RequestParam(name = "targetType", required = false) String targetType,
            @RequestParam(name = "targetId", required = false) String targetId,
            @RequestParam(name = "workspaceId", required = false) Long workspaceId
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        List<Annotation> annotations = collaborationService.getAnnotations(targetType, targetId, userId, workspaceId);
        return ResponseEntity.ok(CollaborationDtoMapper.toAnnotationResponses(annotations));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Annotation found"),
            @ApiResponse(responseCode = "404", description = "Missing, or private to another user")
    })
    @GetMapping("/{annotationId}")
    public ResponseEntity<AnnotationResponse> getAnnotation(@PathVariable("annotationId") Long annotationId) {
        Long userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(CollaborationDtoMapper.toAnnotationResponse(
                collaborationService.getAnnotation(annotationId, userId)
        ));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Annotation updated"),
            @ApiResponse(responseCode = "403", description = "Current user is not the creator"),
            @ApiResponse(responseCode = "404", description = "Annotation not found")
    })
    @PutMapping("/{annotationId}")
    public ResponseEntity<AnnotationResponse> updateAnnotation(
            @PathVariable("annotationId") Long annotationId,
            @Valid @RequestBody UpdateAnnotationRequest request
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        Annotation updated = collaborationService.updateAnnotation(
                annotationId,
                new AnnotationPatch(
                        request.content(),
                        request.isPrivate(),
                        request.isResolved(),
                        request.position(),
                        request.style()
                ),
                userId
        );
        return ResponseEntity.ok(CollaborationDtoMapper.toAnnotationResponse(updated));
    }

    @Operation(summary = "Delete an annotation", description = "Removes its replies and every mention on it or its replies.")
    @DeleteMapping("/{annotationId}")
    public ResponseEntity<Void> deleteAnnotation(@PathVariable("annotationId") Long annotationId) {
        collaborationService.deleteAnnotation(annotationId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{annotationId}/replies")
    public ResponseEntity<ReplyResponse> addReply(
            @PathVariable("annotationId") Long annotationId,
            @Valid @RequestBody CreateReplyRequest request
    ) {
        Long userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.status(201).body(CollaborationDtoMapper.toReplyResponse(
                collaborationService.addReply(annotationId, request.content(), userId, request.mentionedUserIds())
        ));
    }

    @GetMapping("/{annotationId}/replies")
    public ResponseEntity<List<ReplyResponse>> getReplies(@PathVariable("annotationId") Long annotationId) {
        Long userId = SecurityUtils.getCurrentUserId();
        // the parent must be visible before its replies are listed
        collaborationService.getAnnotation(annotationId, userId);
        return ResponseEntity.ok(CollaborationDtoMapper.toReplyResponses(collaborationService.getReplies(annotationId)));
    }
}
