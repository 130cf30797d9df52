package com.collabnote.backend.modules.collaboration.application.event;

@FunctionalInterface
public interface EventHandler {

    void handle(CollaborationEvent event);
}
