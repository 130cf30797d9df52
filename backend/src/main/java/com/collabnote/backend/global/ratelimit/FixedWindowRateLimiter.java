package com.collabnote.backend.global.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts hits per key in fixed windows. A key's window starts with its first hit and resets once it
 * has elapsed.
 */
public class FixedWindowRateLimiter {

    private static final int EVICTION_THRESHOLD = 10_000;

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long windowMillis;

    public FixedWindowRateLimiter(Clock clock, Duration window) {
        this.clock = clock;
        this.windowMillis = window.toMillis();
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public Decision tryAcquire(String key, int limit) {
        long now = clock.millis();
        if (windows.size() > EVICTION_THRESHOLD) {
            windows.values().removeIf(window -> window.isExpired(now, windowMillis));
        }
        Window window = windows.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now, windowMillis)) {
                return new Window(now, 1);
            }
            return new Window(current.startedAt(), current.count() + 1);
        });
        if (window.count() <= limit) {
            return Decision.allowed();
        }
        long remainingMillis = window.startedAt() + windowMillis - now;
        long retryAfterSeconds = Math.max(1, (remainingMillis + 999) / 1000);
        return Decision.rejected(retryAfterSeconds);
    }

    public record Decision(boolean permitted, long retryAfterSeconds) {

        static Decision allowed() {
            return new Decision(true, 0);
        }

        static Decision rejected(long retryAfterSeconds) {
            return new Decision(false, retryAfterSeconds);
        }
    }

    private record Window(long startedAt, int count) {

        boolean isExpired(long now, long windowMillis) {
            return now - startedAt >= windowMillis;
        }
    }
}
