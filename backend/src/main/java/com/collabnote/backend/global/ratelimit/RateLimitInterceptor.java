package com.collabnote.backend.global.ratelimit;

import com.collabnote.backend.global.error.RetryableProblemException;
import com.collabnote.backend.global.ratelimit.FixedWindowRateLimiter.Decision;
import com.collabnote.backend.global.security.SecurityUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the {@code api} bucket to every collaboration request and the stricter {@code create} bucket
 * to POSTs. Callers are keyed by user id, or by remote address when anonymous.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final FixedWindowRateLimiter apiLimiter;
    private final FixedWindowRateLimiter createLimiter;
    private final RateLimitProperties properties;

    public RateLimitInterceptor(
            FixedWindowRateLimiter apiLimiter,
            FixedWindowRateLimiter createLimiter,
            RateLimitProperties properties
    ) {
        this.apiLimiter = apiLimiter;
        this.createLimiter = createLimiter;
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!properties.enabled()) {
            return true;
        }
        String key = SecurityUtils.findCurrentUserId()
                .map(userId -> "user:" + userId)
                .orElseGet(() -> "ip:" + request.getRemoteAddr());

        if ("POST".equalsIgnoreCase(request.getMethod())) {
            enforce(createLimiter.tryAcquire(key, properties.createLimit()), key, "create");
        }
        enforce(apiLimiter.tryAcquire(key, properties.apiLimit()), key, "api");
        return true;
    }

    private static void enforce(Decision decision, String key, String bucket) {
        if (decision.permitted()) {
            return;
        }
        log.warn("Rate limit exceeded for {} on {} bucket", key, bucket);
        throw new RetryableProblemException(
                HttpStatus.TOO_MANY_REQUESTS,
                "RATE_LIMIT_EXCEEDED",
                "Too many requests, retry in " + decision.retryAfterSeconds() + "s",
                decision.retryAfterSeconds()
        );
    }
}
