package com.collabnote.backend.global.jpa;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;

/**
 * Creation and last-update timestamps shared by collaboration entities.
 * Services stamp {@code updated_at} through {@link #markUpdated(OffsetDateTime)} with their own clock
 * so that edits and the events describing them agree on the instant.
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public void markCreated(OffsetDateTime now) {
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void markUpdated(OffsetDateTime now) {
        this.updatedAt = now;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
