package com.collabnote.backend.modules.realtime.infrastructure.health;

import com.collabnote.backend.modules.realtime.application.ConnectionRegistry;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("realtimeConnections")
public class RealtimeConnectionsHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry connectionRegistry;

    public RealtimeConnectionsHealthIndicator(ConnectionRegistry connectionRegistry) {
        this.connectionRegistry = connectionRegistry;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("openConnections", connectionRegistry.openCount())
                .build();
    }
}
