package com.collabnote.backend.modules.realtime.infrastructure.websocket;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound frame sent by clients: {@code auth}, {@code subscribe}, {@code unsubscribe}, {@code workspace},
 * {@code heartbeat}, {@code update}, {@code request_users} or {@code ping}. Only the fields relevant to
 * the type are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ClientControlMessage(
        String type,
        String token,
        String targetType,
        String targetId,
        Long workspaceId,
        PresencePatch presence
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PresencePatch(String status, String currentPage, String currentView, Map<String, Object> metadata) {
    }
}
