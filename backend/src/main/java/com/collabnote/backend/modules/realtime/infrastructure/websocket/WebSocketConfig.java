package com.collabnote.backend.modules.realtime.infrastructure.websocket;

import com.collabnote.backend.modules.realtime.application.RealtimeProperties;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeProperties properties;
    private final CollaborationWebSocketHandler handler;
    private final CollaborationHandshakeInterceptor handshakeInterceptor;

    public WebSocketConfig(
            RealtimeProperties properties,
            CollaborationWebSocketHandler handler,
            CollaborationHandshakeInterceptor handshakeInterceptor
    ) {
        this.properties = properties;
        this.handler = handler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.endpoint())
                .addInterceptors(handshakeInterceptor)
                .setAllowedOriginPatterns(properties.allowedOrigins().toArray(new String[0]));
    }
}
