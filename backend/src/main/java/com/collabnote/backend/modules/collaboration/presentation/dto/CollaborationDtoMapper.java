package com.collabnote.backend.modules.collaboration.presentation.dto;

import java.util.List;

import com.collabnote.backend.modules.collaboration.domain.Annotation;
import com.collabnote.backend.modules.collaboration.domain.AnnotationMention;
import com.collabnote.backend.modules.collaboration.domain.AnnotationReply;

public final class CollaborationDtoMapper {

    private CollaborationDtoMapper() {
    }

    public static AnnotationResponse toAnnotationResponse(Annotation annotation) {
        return new AnnotationResponse(
                annotation.getId(),
                annotation.getContent(),
                annotation.getTargetType(),
                annotation.getTargetId(),
                annotation.getPosition(),
                annotation.getStyle(),
                annotation.getWorkspaceId(),
                annotation.getCreatorId(),
                annotation.isPrivate(),
                annotation.isResolved(),
                annotation.getCreatedAt(),
                annotation.getUpdatedAt()
        );
    }

    public static List<AnnotationResponse> toAnnotationResponses(List<Annotation> annotations) {
        return annotations.stream()
                .map(CollaborationDtoMapper::toAnnotationResponse)
                .toList();
    }

    public static ReplyResponse toReplyResponse(AnnotationReply reply) {
        return new ReplyResponse(
                reply.getId(),
                reply.getAnnotationId(),
                reply.getContent(),
                reply.getUserId(),
                reply.getCreatedAt(),
                reply.getUpdatedAt()
        );
    }

    public static List<ReplyResponse> toReplyResponses(List<AnnotationReply> replies) {
        return replies.stream()
                .map(CollaborationDtoMapper::toReplyResponse)
                .toList();
    }

    public static MentionResponse toMentionResponse(
            AnnotationMention mention,
            Annotation annotation,
            AnnotationReply reply
    ) {
        return new MentionResponse(
                mention.getId(),
                mention.getAnnotationId(),
                mention.getReplyId(),
                mention.getUserId(),
                mention.getMentionedBy(),
                mention.getCreatedAt(),
                annotation != null ? toAnnotationResponse(annotation) : null,
                reply != null ? toReplyResponse(reply) : null
        );
    }
}
