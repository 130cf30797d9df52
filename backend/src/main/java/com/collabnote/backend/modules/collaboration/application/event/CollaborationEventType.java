package com.collabnote.backend.modules.collaboration.application.event;

import java.util.Arrays;
import java.util.Optional;

public enum CollaborationEventType {
    ANNOTATION_CREATED("annotation.created"),
    ANNOTATION_UPDATED("annotation.updated"),
    ANNOTATION_DELETED("annotation.deleted"),
    REPLY_CREATED("reply.created"),
    REPLY_UPDATED("reply.updated"),
    REPLY_DELETED("reply.deleted"),
    MENTION_CREATED("mention.created");

    private final String eventName;

    CollaborationEventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Key used on the event bus, e.g. {@code annotation.created}.
     */
    public String eventName() {
        return eventName;
    }

    /**
     * Name sent to clients in the {@code type} field, e.g. {@code annotation_created}.
     */
    public String messageType() {
        return eventName.replace('.', '_');
    }

    public static Optional<CollaborationEventType> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(type -> type.eventName.equals(eventName))
                .findFirst();
    }
}
