package com.collabnote.backend.modules.collaboration.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.collabnote.backend.modules.collaboration.application.event.CollaborationEvent;
import com.collabnote.backend.modules.collaboration.application.event.CollaborationEventPublisher;
import com.collabnote.backend.modules.collaboration.application.event.CollaborationEventType;
import com.collabnote.backend.modules.collaboration.domain.Annotation;
import com.collabnote.backend.modules.collaboration.domain.AnnotationMention;
import com.collabnote.backend.modules.collaboration.domain.AnnotationReply;
import com.collabnote.backend.modules.collaboration.domain.AnnotationTarget;
import com.collabnote.backend.modules.collaboration.infrastructure.persistence.AnnotationMentionRepository;
import com.collabnote.backend.modules.collaboration.infrastructure.persistence.AnnotationReplyRepository;
import com.collabnote.backend.modules.collaboration.infrastructure.persistence.AnnotationRepository;
import com.collabnote.backend.modules.collaboration.presentation.dto.CollaborationDtoMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

/**
 * Ownership and visibility rules for annotations, replies and mentions.
 * <p>
 * Every write runs in one transaction and announces itself on the event bus after commit.
 * Concurrent updates of the same row are last-write-wins.
 */
@Service
@Transactional
public class CollaborationService {

    private static final Logger log = LoggerFactory.getLogger(CollaborationService.class);

    private final AnnotationRepository annotationRepository;
    private final AnnotationReplyRepository replyRepository;
    private final AnnotationMentionRepository mentionRepository;
    private final CollaborationEventPublisher eventPublisher;
    private final Clock clock;

    public CollaborationService(
            AnnotationRepository annotationRepository,
            AnnotationReplyRepository replyRepository,
            AnnotationMentionRepository mentionRepository,
            CollaborationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.annotationRepository = annotationRepository;
        this.replyRepository = replyRepository;
        this.mentionRepository = mentionRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Annotation createAnnotation(NewAnnotation data, Long userId) {
        requireUser(userId);
        Map<String, String> errors = new LinkedHashMap<>();
        if (!StringUtils.hasText(data.content())) {
            errors.put("content", "must not be blank");
        }
        if (!StringUtils.hasText(data.targetType())) {
            errors.put("targetType", "must not be blank");
        }
        if (!StringUtils.hasText(data.targetId())) {
            errors.put("targetId", "must not be blank");
        }
        if (!errors.isEmpty()) {
            throw CollaborationException.validation(errors);
        }

        Annotation annotation = new Annotation(
                AnnotationTarget.of(data.targetType(), data.targetId()),
                data.workspaceId(),
                userId,
                data.content()
        );
        annotation.setPosition(data.position());
        annotation.setStyle(data.style());
        annotation.setPrivate(Boolean.TRUE.equals(data.isPrivate()));
        annotation.markCreated(now());
        Annotation saved = annotationRepository.save(annotation);
        log.info("Annotation {} created on {}:{} by user {}", saved.getId(), saved.getTargetType(), saved.getTargetId(), userId);

        eventPublisher.publishAfterCommit(annotationEvent(CollaborationEventType.ANNOTATION_CREATED, saved, userId)
                .data(CollaborationDtoMapper.toAnnotationResponse(saved))
                .build());

        for (Long mentionedUserId : distinct(data.mentionedUserIds())) {
            addMention(new NewMention(saved.getId(), null, mentionedUserId, userId));
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Annotation> getAnnotations(String targetType, String targetId, Long userId, Long workspaceId) {
        requireUser(userId);
        Map<String, String> errors = new LinkedHashMap<>();
        if (!StringUtils.hasText(targetType)) {
            errors.put("targetType", "must not be blank");
        }
        if (!StringUtils.hasText(targetId)) {
            errors.put("targetId", "must not be blank");
        }
        if (!errors.isEmpty()) {
            throw CollaborationException.validation(errors);
        }
        return annotationRepository.findVisibleByTarget(targetType, targetId, userId, workspaceId);
    }

    /**
     * Missing annotations and private annotations of other users are reported identically.
     */
    @Transactional(readOnly = true)
    public Annotation getAnnotation(Long id, Long userId) {
        requireUser(userId);
        return annotationRepository.findById(id)
                .filter(annotation -> annotation.isVisibleTo(userId))
                .orElseThrow(() -> CollaborationException.notFoundOrForbidden(
                        "ANNOTATION_NOT_FOUND_OR_FORBIDDEN",
                        "Annotation not found or access denied"
                ));
    }

    public Annotation updateAnnotation(Long id, AnnotationPatch patch, Long userId) {
        Annotation annotation = loadOwnedAnnotation(id, userId);
        if (patch.content() != null && !StringUtils.hasText(patch.content())) {
            throw CollaborationException.validation("content", "must not be blank");
        }
        boolean wasPrivate = annotation.isPrivate();

        if (patch.content() != null) {
            annotation.setContent(patch.content());
        }
        if (patch.isPrivate() != null) {
            annotation.setPrivate(patch.isPrivate());
        }
        if (patch.isResolved() != null) {
            annotation.setResolved(patch.isResolved());
        }
        if (patch.position() != null) {
            annotation.setPosition(patch.position());
        }
        if (patch.style() != null) {
            annotation.setStyle(patch.style());
        }
        annotation.markUpdated(now());
        Annotation saved = annotationRepository.save(annotation);

        eventPublisher.publishAfterCommit(annotationEvent(CollaborationEventType.ANNOTATION_UPDATED, saved, userId)
                .data(CollaborationDtoMapper.toAnnotationResponse(saved))
                .build());
        if (!wasPrivate && saved.isPrivate()) {
            // everyone but the creator loses sight of it
            eventPublisher.publishAfterCommit(annotationEvent(CollaborationEventType.ANNOTATION_DELETED, saved, userId)
                    .restrictedTo(null)
                    .excluding(saved.getCreatorId())
                    .data(deletedView(saved))
                    .build());
        }
        return saved;
    }

    public void deleteAnnotation(Long id, Long userId) {
        Annotation annotation = loadOwnedAnnotation(id, userId);
        CollaborationEvent event = annotationEvent(CollaborationEventType.ANNOTATION_DELETED, annotation, userId)
                .data(deletedView(annotation))
                .build();

        List<Long> replyIds = replyRepository.findIdsByAnnotationId(id);
        int removedMentions = 0;
        if (!replyIds.isEmpty()) {
            removedMentions += mentionRepository.deleteByReplyIdIn(replyIds);
        }
        removedMentions += mentionRepository.deleteByAnnotationId(id);
        replyRepository.deleteByAnnotationId(id);
        annotationRepository.delete(annotation);
        log.info("Annotation {} deleted by user {} ({} replies, {} mentions)", id, userId, replyIds.size(), removedMentions);

        eventPublisher.publishAfterCommit(event);
    }

    public AnnotationReply addReply(Long annotationId, String content, Long userId) {
        return addReply(annotationId, content, userId, List.of());
    }

    public AnnotationReply addReply(Long annotationId, String content, Long userId, List<Long> mentionedUserIds) {
        Annotation annotation = getAnnotation(annotationId, userId);
        if (!StringUtils.hasText(content)) {
            throw CollaborationException.validation("content", "must not be blank");
        }

        AnnotationReply reply = new AnnotationReply(annotation.getId(), userId, content);
        reply.markCreated(now());
        AnnotationReply saved = replyRepository.save(reply);

        eventPublisher.publishAfterCommit(replyEvent(CollaborationEventType.REPLY_CREATED, annotation, saved.getId(), userId)
                .data(CollaborationDtoMapper.toReplyResponse(saved))
                .build());

        for (Long mentionedUserId : distinct(mentionedUserIds)) {
            addMention(new NewMention(null, saved.getId(), mentionedUserId, userId));
        }
        return saved;
    }

    /**
     * Replies in creation order. Unknown annotations yield an empty list; callers authorize the parent first.
     */
    @Transactional(readOnly = true)
    public List<AnnotationReply> getReplies(Long annotationId) {
        return replyRepository.findByAnnotationIdOrderByCreatedAtAscIdAsc(annotationId);
    }

    public AnnotationReply updateReply(Long id, String content, Long userId) {
        AnnotationReply reply = loadOwnedReply(id, userId);
        if (!StringUtils.hasText(content)) {
            throw CollaborationException.validation("content", "must not be blank");
        }
        reply.setContent(content);
        reply.markUpdated(now());
        AnnotationReply saved = replyRepository.save(reply);

        Optional<Annotation> parent = annotationRepository.findById(saved.getAnnotationId());
        eventPublisher.publishAfterCommit(replyEvent(CollaborationEventType.REPLY_UPDATED, parent, saved, userId)
                .data(CollaborationDtoMapper.toReplyResponse(saved))
                .build());
        return saved;
    }

    public void deleteReply(Long id, Long userId) {
        AnnotationReply reply = loadOwnedReply(id, userId);
        Optional<Annotation> parent = annotationRepository.findById(reply.getAnnotationId());
        CollaborationEvent event = replyEvent(CollaborationEventType.REPLY_DELETED, parent, reply, userId)
                .data(new DeletedReply(reply.getId(), reply.getAnnotationId()))
                .build();

        mentionRepository.deleteByReplyIdIn(List.of(id));
        replyRepository.delete(reply);
        log.info("Reply {} on annotation {} deleted by user {}", id, reply.getAnnotationId(), userId);

        eventPublisher.publishAfterCommit(event);
    }

    /**
     * Stores a mention on exactly one annotation or reply. The event is only published when the owning
     * annotation can be resolved; a mention on a reply whose annotation is gone is kept silently.
     */
    public AnnotationMention addMention(NewMention data) {
        Map<String, String> errors = new LinkedHashMap<>();
        boolean hasAnnotation = data.annotationId() != null;
        boolean hasReply = data.replyId() != null;
        if (hasAnnotation == hasReply) {
            errors.put("annotationId", "exactly one of annotationId or replyId is required");
        }
        if (data.userId() == null) {
            errors.put("userId", "must not be null");
        }
        if (!errors.isEmpty()) {
            throw CollaborationException.validation(errors);
        }

        Optional<Annotation> owner;
        AnnotationMention mention;
        if (hasAnnotation) {
            Annotation annotation = annotationRepository.findById(data.annotationId())
                    .orElseThrow(() -> annotationNotFound(data.annotationId()));
            owner = Optional.of(annotation);
            mention = AnnotationMention.onAnnotation(annotation.getId(), data.userId(), data.mentionedBy(), now());
        } else {
            AnnotationReply reply = replyRepository.findById(data.replyId())
                    .orElseThrow(() -> replyNotFound(data.replyId()));
            owner = annotationRepository.findById(reply.getAnnotationId());
            mention = AnnotationMention.onReply(reply.getId(), data.userId(), data.mentionedBy(), now());
        }
        AnnotationMention saved = mentionRepository.save(mention);

        if (owner.isEmpty()) {
            log.warn("Mention {} stored without broadcast, reply {} has no annotation", saved.getId(), data.replyId());
            return saved;
        }
        Annotation annotation = owner.get();
        eventPublisher.publishAfterCommit(CollaborationEvent.builder(CollaborationEventType.MENTION_CREATED)
                .userId(data.mentionedBy())
                .workspaceId(annotation.getWorkspaceId())
                .target(annotation.getTargetType(), annotation.getTargetId())
                .annotationId(annotation.getId())
                .replyId(saved.getReplyId())
                .mentionedUserId(saved.getUserId())
                .restrictedTo(restrictionOf(annotation))
                .data(CollaborationDtoMapper.toMentionResponse(saved, null, null))
                .build());
        return saved;
    }

    /**
     * Mentions of the user, newest first. The parent annotation is attached only while the user can see it.
     */
    @Transactional(readOnly = true)
    public List<MentionView> getUserMentions(Long userId) {
        requireUser(userId);
        return mentionRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(mention -> toMentionView(mention, userId))
                .toList();
    }

    private MentionView toMentionView(AnnotationMention mention, Long userId) {
        AnnotationReply reply = mention.getReplyId() != null
                ? replyRepository.findById(mention.getReplyId()).orElse(null)
                : null;
        Long annotationId = mention.getAnnotationId() != null
                ? mention.getAnnotationId()
                : (reply != null ? reply.getAnnotationId() : null);
        Annotation annotation = annotationId != null
                ? annotationRepository.findById(annotationId).filter(a -> a.isVisibleTo(userId)).orElse(null)
                : null;
        if (annotation == null) {
            reply = null;
        }
        return new MentionView(mention, annotation, reply);
    }

    private Annotation loadOwnedAnnotation(Long id, Long userId) {
        requireUser(userId);
        Annotation annotation = annotationRepository.findById(id)
                .orElseThrow(() -> annotationNotFound(id));
        if (!annotation.isOwnedBy(userId)) {
            throw CollaborationException.forbidden("ANNOTATION_FORBIDDEN", "Only the creator can modify this annotation");
        }
        return annotation;
    }

    private AnnotationReply loadOwnedReply(Long id, Long userId) {
        requireUser(userId);
        AnnotationReply reply = replyRepository.findById(id)
                .orElseThrow(() -> replyNotFound(id));
        if (!reply.isAuthoredBy(userId)) {
            throw CollaborationException.forbidden("REPLY_FORBIDDEN", "Only the author can modify this reply");
        }
        return reply;
    }

    private CollaborationEvent.Builder annotationEvent(CollaborationEventType type, Annotation annotation, Long userId) {
        return CollaborationEvent.builder(type)
                .userId(userId)
                .workspaceId(annotation.getWorkspaceId())
                .target(annotation.getTargetType(), annotation.getTargetId())
                .annotationId(annotation.getId())
                .restrictedTo(restrictionOf(annotation));
    }

    private CollaborationEvent.Builder replyEvent(CollaborationEventType type, Annotation annotation, Long replyId, Long userId) {
        return annotationEvent(type, annotation, userId).replyId(replyId);
    }

    private CollaborationEvent.Builder replyEvent(
            CollaborationEventType type,
            Optional<Annotation> parent,
            AnnotationReply reply,
            Long userId
    ) {
        if (parent.isPresent()) {
            return replyEvent(type, parent.get(), reply.getId(), userId);
        }
        return CollaborationEvent.builder(type)
                .userId(userId)
                .annotationId(reply.getAnnotationId())
                .replyId(reply.getId());
    }

    private static DeletedAnnotation deletedView(Annotation annotation) {
        return new DeletedAnnotation(
                annotation.getId(),
                annotation.getTargetType(),
                annotation.getTargetId(),
                annotation.getWorkspaceId()
        );
    }

    private static Long restrictionOf(Annotation annotation) {
        return annotation.isPrivate() ? annotation.getCreatorId() : null;
    }

    private static CollaborationException annotationNotFound(Long id) {
        return CollaborationException.notFound("ANNOTATION_NOT_FOUND", "Annotation " + id + " not found");
    }

    private static CollaborationException replyNotFound(Long id) {
        return CollaborationException.notFound("REPLY_NOT_FOUND", "Reply " + id + " not found");
    }

    private static void requireUser(Long userId) {
        if (userId == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
    }

    private static LinkedHashSet<Long> distinct(List<Long> userIds) {
        LinkedHashSet<Long> result = new LinkedHashSet<>();
        if (userIds != null) {
            userIds.stream().filter(id -> id != null).forEach(result::add);
        }
        return result;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public record NewAnnotation(
            String content,
            String targetType,
            String targetId,
            Map<String, Object> position,
            Map<String, Object> style,
            Long workspaceId,
            Boolean isPrivate,
            List<Long> mentionedUserIds
    ) {
    }

    public record AnnotationPatch(
            String content,
            Boolean isPrivate,
            Boolean isResolved,
            Map<String, Object> position,
            Map<String, Object> style
    ) {
    }

    public record NewMention(Long annotationId, Long replyId, Long userId, Long mentionedBy) {
    }

    public record MentionView(AnnotationMention mention, Annotation annotation, AnnotationReply reply) {
    }

    public record DeletedAnnotation(Long id, String targetType, String targetId, Long workspaceId) {
    }

    public record DeletedReply(Long id, Long annotationId) {
    }
}
