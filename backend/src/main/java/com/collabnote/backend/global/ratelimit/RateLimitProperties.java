package com.collabnote.backend.global.ratelimit;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "collaboration.rate-limit")
public record RateLimitProperties(
        Boolean enabled,
        Duration window,
        Integer apiLimit,
        Integer createLimit
) {

    public RateLimitProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (window == null || window.isZero() || window.isNegative()) {
            window = Duration.ofMinutes(1);
        }
        if (apiLimit == null || apiLimit < 1) {
            apiLimit = 100;
        }
        if (createLimit == null || createLimit < 1) {
            createLimit = 20;
        }
    }
}
