package com.collabnote.backend.modules.realtime.application;

import java.time.Clock;
import java.util.List;

import com.collabnote.backend.modules.collaboration.application.event.CollaborationEvent;
import com.collabnote.backend.modules.collaboration.application.event.CollaborationEventType;
import com.collabnote.backend.modules.collaboration.application.event.EventBus;
import com.collabnote.backend.modules.realtime.domain.ClientConnection;
import com.collabnote.backend.modules.realtime.domain.ConnectionSelector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns collaboration events into wire messages and queues them on the connections that should see them.
 */
@Component
public class BroadcastRouter {

    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final EventBus eventBus;
    private final ConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BroadcastRouter(EventBus eventBus, ConnectionRegistry connectionRegistry, ObjectMapper objectMapper, Clock clock) {
        this.eventBus = eventBus;
        this.connectionRegistry = connectionRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void subscribe() {
        for (CollaborationEventType type : CollaborationEventType.values()) {
            eventBus.subscribe(type, this::broadcast);
        }
    }

    /**
     * @return number of connections the message was queued on
     */
    public int broadcast(CollaborationEvent event) {
        ConnectionSelector selector = ConnectionSelector.forEvent(event);
        List<ClientConnection> recipients = connectionRegistry.selectOpen(selector);
        if (recipients.isEmpty()) {
            log.debug("No recipients for {} ({})", event.type().eventName(), selector);
            return 0;
        }

        String payload = serialize(event.type().messageType(), toEventData(event));
        Long restrictedTo = event.restrictedToUserId();
        Long excluded = event.excludedUserId();
        int queued = 0;
        for (ClientConnection connection : recipients) {
            if (restrictedTo != null && !restrictedTo.equals(connection.getUserId())) {
                continue;
            }
            if (excluded != null && excluded.equals(connection.getUserId())) {
                continue;
            }
            if (connection.enqueue(payload)) {
                queued++;
            }
        }
        log.debug("Queued {} on {} of {} matching connections", event.type().messageType(), queued, recipients.size());
        return queued;
    }

    /**
     * Queues a single message on one connection, used for control replies.
     */
    public boolean send(ClientConnection connection, String type, Object data) {
        return connection.enqueue(serialize(type, data));
    }

    /**
     * Queues one message on every open connection matching {@code selector} except {@code skipConnectionId}.
     *
     * @return number of connections the message was queued on
     */
    public int sendToSelected(ConnectionSelector selector, String type, Object data, String skipConnectionId) {
        List<ClientConnection> recipients = connectionRegistry.selectOpen(selector);
        if (recipients.isEmpty()) {
            return 0;
        }
        String payload = serialize(type, data);
        int queued = 0;
        for (ClientConnection connection : recipients) {
            if (connection.getConnectionId().equals(skipConnectionId)) {
                continue;
            }
            if (connection.enqueue(payload)) {
                queued++;
            }
        }
        return queued;
    }

    private String serialize(String type, Object data) {
        OutboundMessage message = new OutboundMessage(type, data, clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + type + " message", ex);
        }
    }

    private static OutboundMessage.EventData toEventData(CollaborationEvent event) {
        return new OutboundMessage.EventData(
                event.userId(),
                event.workspaceId(),
                event.targetType(),
                event.targetId(),
                event.annotationId(),
                event.replyId(),
                event.mentionedUserId(),
                event.data()
        );
    }
}
