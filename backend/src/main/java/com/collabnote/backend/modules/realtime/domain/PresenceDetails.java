package com.collabnote.backend.modules.realtime.domain;

import java.util.Map;

/**
 * What a user reports about where they are in the client. {@code null} means "not reported".
 */
public record PresenceDetails(String currentPage, String currentView, Map<String, Object> metadata) {

    public static final PresenceDetails EMPTY = new PresenceDetails(null, null, null);

    public PresenceDetails {
        metadata = metadata == null ? null : Map.copyOf(metadata);
    }

    /**
     * Overlays the non-null fields of {@code patch}.
     */
    public PresenceDetails merge(PresenceDetails patch) {
        if (patch == null) {
            return this;
        }
        return new PresenceDetails(
                patch.currentPage() != null ? patch.currentPage() : currentPage,
                patch.currentView() != null ? patch.currentView() : currentView,
                patch.metadata() != null ? patch.metadata() : metadata
        );
    }
}
