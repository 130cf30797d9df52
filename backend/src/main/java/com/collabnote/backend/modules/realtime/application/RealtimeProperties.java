package com.collabnote.backend.modules.realtime.application;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param deliveryThreads    delivery threads kept warm
 * @param maxDeliveryThreads upper bound the delivery pool grows to while writes are blocked
 * @param sendTimeLimit      how long a single write may block before the connection is dropped
 * @param awayAfter          inactivity after which an online user is shown as away
 * @param offlineAfter       inactivity after which a user is shown as offline
 */
@ConfigurationProperties(prefix = "collaboration.realtime")
public record RealtimeProperties(
        String endpoint,
        List<String> allowedOrigins,
        Integer maxPendingMessages,
        Integer deliveryThreads,
        Integer maxDeliveryThreads,
        Integer maxTargets,
        Duration sendTimeLimit,
        Integer sendBufferSizeLimit,
        Duration awayAfter,
        Duration offlineAfter
) {

    public RealtimeProperties {
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = "/ws/collaboration";
        }
        allowedOrigins = (allowedOrigins == null || allowedOrigins.isEmpty()) ? List.of("*") : List.copyOf(allowedOrigins);
        if (maxPendingMessages == null || maxPendingMessages < 1) {
            maxPendingMessages = 256;
        }
        if (deliveryThreads == null || deliveryThreads < 1) {
            deliveryThreads = 4;
        }
        if (maxDeliveryThreads == null || maxDeliveryThreads < deliveryThreads) {
            maxDeliveryThreads = Math.max(256, deliveryThreads);
        }
        if (maxTargets == null || maxTargets < 1) {
            maxTargets = 100;
        }
        if (sendTimeLimit == null || sendTimeLimit.isNegative() || sendTimeLimit.isZero()) {
            sendTimeLimit = Duration.ofSeconds(10);
        }
        if (sendBufferSizeLimit == null || sendBufferSizeLimit < 1) {
            sendBufferSizeLimit = 512 * 1024;
        }
        if (awayAfter == null || awayAfter.isNegative()) {
            awayAfter = Duration.ofMinutes(2);
        }
        if (offlineAfter == null || offlineAfter.isNegative()) {
            offlineAfter = Duration.ofMinutes(5);
        }
        if (offlineAfter.compareTo(awayAfter) < 0) {
            offlineAfter = awayAfter;
        }
    }

    public static RealtimeProperties defaults() {
        return new RealtimeProperties(null, null, null, null, null, null, null, null, null, null);
    }
}
