package com.collabnote.backend.modules.collaboration.domain;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

/**
 * A user mentioned on exactly one annotation or reply. Immutable once stored.
 */
@Entity
@Table(name = "collaboration_annotation_mention")
public class AnnotationMention {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "annotation_id", updatable = false)
    private Long annotationId;

    @Column(name = "reply_id", updatable = false)
    private Long replyId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "mentioned_by", updatable = false)
    private Long mentionedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AnnotationMention() {
    }

    private AnnotationMention(Long annotationId, Long replyId, Long userId, Long mentionedBy, OffsetDateTime createdAt) {
        this.annotationId = annotationId;
        this.replyId = replyId;
        this.userId = userId;
        this.mentionedBy = mentionedBy;
        this.createdAt = createdAt;
    }

    public static AnnotationMention onAnnotation(Long annotationId, Long userId, Long mentionedBy, OffsetDateTime createdAt) {
        return new AnnotationMention(annotationId, null, userId, mentionedBy, createdAt);
    }

    public static AnnotationMention onReply(Long replyId, Long userId, Long mentionedBy, OffsetDateTime createdAt) {
        return new AnnotationMention(null, replyId, userId, mentionedBy, createdAt);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        }
    }

    public Long getId() {
        return id;
    }

    public Long getAnnotationId() {
        return annotationId;
    }

    public Long getReplyId() {
        return replyId;
    }

    public Long getUserId() {
        return userId;
    }

    public Long getMentionedBy() {
        return mentionedBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
