package com.collabnote.backend.modules.realtime.application;

import java.time.Duration;
import java.util.List;

import com.collabnote.backend.modules.realtime.domain.ClientConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RealtimeMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeMaintenanceScheduler.class);

    private final ConnectionRegistry connectionRegistry;
    private final PresenceService presenceService;
    private final Duration sendTimeLimit;

    public RealtimeMaintenanceScheduler(
            ConnectionRegistry connectionRegistry,
            PresenceService presenceService,
            RealtimeProperties properties
    ) {
        this.connectionRegistry = connectionRegistry;
        this.presenceService = presenceService;
        this.sendTimeLimit = properties.sendTimeLimit();
    }

    @Scheduled(fixedDelayString = "${collaboration.realtime.presence-sweep-interval:PT30S}")
    public void sweep() {
        List<ClientConnection> dropped = connectionRegistry.closeStalled(sendTimeLimit);
        for (ClientConnection connection : dropped) {
            presenceService.connectionClosed(connection);
        }
        if (!dropped.isEmpty()) {
            log.info("Dropped {} connections with blocked sends", dropped.size());
        }
        presenceService.sweepInactive();
    }
}
