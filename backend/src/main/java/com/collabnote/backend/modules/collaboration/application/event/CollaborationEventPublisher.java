package com.collabnote.backend.modules.collaboration.application.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Hands events to the {@link EventBus} once the surrounding transaction has committed, or straight
 * away when no transaction is active. A rolled back write publishes nothing.
 */
@Component
public class CollaborationEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(CollaborationEventPublisher.class);

    private final EventBus eventBus;

    public CollaborationEventPublisher(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void publishAfterCommit(CollaborationEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
            return;
        }
        dispatch(event);
    }

    private void dispatch(CollaborationEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} for annotation {}", event.type().eventName(), event.annotationId(), ex);
        }
    }
}
