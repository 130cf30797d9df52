package com.collabnote.backend.modules.realtime.infrastructure.websocket;

import java.io.IOException;
import java.time.Duration;

import com.collabnote.backend.modules.realtime.domain.OutboundChannel;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator} bounded by the configured send time
 * and buffer size.
 */
class WebSocketOutboundChannel implements OutboundChannel {

    private final WebSocketSession session;

    WebSocketOutboundChannel(WebSocketSession session, Duration sendTimeLimit, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, (int) sendTimeLimit.toMillis(), sendBufferSizeLimit);
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() throws IOException {
        session.close(CloseStatus.SESSION_NOT_RELIABLE);
    }
}
