package com.collabnote.backend.modules.collaboration.domain;

import java.util.Map;
import java.util.Objects;

import com.collabnote.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "collaboration_annotation")
public class Annotation extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "content", nullable = false, length = 10000)
    private String content;

    @Column(name = "target_type", nullable = false, updatable = false, length = 255)
    private String targetType;

    @Column(name = "target_id", nullable = false, updatable = false, length = 255)
    private String targetId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "position")
    private Map<String, Object> position;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "style")
    private Map<String, Object> style;

    @Column(name = "workspace_id", updatable = false)
    private Long workspaceId;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private Long creatorId;

    @Column(name = "is_private", nullable = false)
    private boolean privateAnnotation;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved;

    protected Annotation() {
    }

    public Annotation(AnnotationTarget target, Long workspaceId, Long creatorId, String content) {
        this.targetType = target.type();
        this.targetId = target.id();
        this.workspaceId = workspaceId;
        this.creatorId = Objects.requireNonNull(creatorId, "creatorId");
        this.content = content;
    }

    public boolean isOwnedBy(Long userId) {
        return userId != null && userId.equals(creatorId);
    }

    /**
     * Public annotations are visible to everyone, private ones only to their creator.
     */
    public boolean isVisibleTo(Long userId) {
        return !privateAnnotation || isOwnedBy(userId);
    }

    public AnnotationTarget getTarget() {
        return new AnnotationTarget(targetType, targetId);
    }

    public Long getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getTargetType() {
        return targetType;
    }

    public String getTargetId() {
        return targetId;
    }

    public Map<String, Object> getPosition() {
        return position;
    }

    public void setPosition(Map<String, Object> position) {
        this.position = position;
    }

    public Map<String, Object> getStyle() {
        return style;
    }

    public void setStyle(Map<String, Object> style) {
        this.style = style;
    }

    public Long getWorkspaceId() {
        return workspaceId;
    }

    public Long getCreatorId() {
        return creatorId;
    }

    public boolean isPrivate() {
        return privateAnnotation;
    }

    public void setPrivate(boolean privateAnnotation) {
        this.privateAnnotation = privateAnnotation;
    }

    public boolean isResolved() {
        return resolved;
    }

    public void setResolved(boolean resolved) {
        this.resolved = resolved;
    }
}
