package com.collabnote.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Problem the caller may retry once {@link #getRetryAfterSeconds()} has elapsed.
 * Rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RetryableProblemException(HttpStatus status, String code, long retryAfterSeconds) {
        this(status, code, null, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
