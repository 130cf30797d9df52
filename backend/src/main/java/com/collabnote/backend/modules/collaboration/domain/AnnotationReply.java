package com.collabnote.backend.modules.collaboration.domain;

import java.util.Objects;

import com.collabnote.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "collaboration_annotation_reply")
public class AnnotationReply extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "annotation_id", nullable = false, updatable = false)
    private Long annotationId;

    @Column(name = "content", nullable = false, length = 10000)
    private String content;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    protected AnnotationReply() {
    }

    public AnnotationReply(Long annotationId, Long userId, String content) {
        this.annotationId = Objects.requireNonNull(annotationId, "annotationId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.content = content;
    }

    public boolean isAuthoredBy(Long candidate) {
        return candidate != null && candidate.equals(userId);
    }

    public Long getId() {
        return id;
    }

    public Long getAnnotationId() {
        return annotationId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Long getUserId() {
        return userId;
    }
}
