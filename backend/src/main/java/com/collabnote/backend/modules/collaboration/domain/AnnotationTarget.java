package com.collabnote.backend.modules.collaboration.domain;

import java.util.Objects;

/**
 * Addressing pair for the resource an annotation is attached to, e.g. {@code ("policy", "42")}.
 */
public record AnnotationTarget(String type, String id) {

    public AnnotationTarget {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static AnnotationTarget of(String type, String id) {
        return new AnnotationTarget(type, id);
    }
}
