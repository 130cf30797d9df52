package com.collabnote.backend.modules.collaboration.application.event;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process publish/subscribe keyed by event name ({@code annotation.created}, ...).
 * <p>
 * {@link #publish} runs every handler registered for the event name on the calling thread, in
 * registration order. A handler that throws is logged and skipped; the remaining handlers still run
 * and the publisher never sees the failure. Nothing is persisted or replayed.
 */
@Component
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    public void subscribe(String eventName, EventHandler handler) {
        handlers.computeIfAbsent(eventName, key -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Handler registered for {}", eventName);
    }

    public void subscribe(CollaborationEventType type, EventHandler handler) {
        subscribe(type.eventName(), handler);
    }

    public boolean unsubscribe(String eventName, EventHandler handler) {
        List<EventHandler> registered = handlers.get(eventName);
        return registered != null && registered.remove(handler);
    }

    public void publish(CollaborationEvent event) {
        publish(event.type().eventName(), event);
    }

    public void publish(String eventName, CollaborationEvent event) {
        List<EventHandler> registered = handlers.get(eventName);
        if (registered == null || registered.isEmpty()) {
            log.debug("No handlers for {}", eventName);
            return;
        }
        for (EventHandler handler : registered) {
            try {
                handler.handle(event);
            } catch (RuntimeException ex) {
                log.error("Event handler failed for {}", eventName, ex);
            }
        }
    }

    public int getHandlerCount(String eventName) {
        List<EventHandler> registered = handlers.get(eventName);
        return registered == null ? 0 : registered.size();
    }

    public Set<String> getRegisteredEventTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
