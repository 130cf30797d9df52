package com.collabnote.backend.global.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import com.collabnote.backend.global.error.RetryableProblemException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitInterceptorTest {

    private RateLimitInterceptor interceptor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);
        RateLimitProperties properties = new RateLimitProperties(true, Duration.ofMinutes(1), 3, 2);
        interceptor = new RateLimitInterceptor(
                new FixedWindowRateLimiter(clock, properties.window()),
                new FixedWindowRateLimiter(clock, properties.window()),
                properties
        );
    }

    @Test
    void createBucketIsStricterThanApiBucket() {
        assertThat(interceptor.preHandle(request("POST"), new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(interceptor.preHandle(request("POST"), new MockHttpServletResponse(), new Object())).isTrue();

        assertThatThrownBy(() -> interceptor.preHandle(request("POST"), new MockHttpServletResponse(), new Object()))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo("RATE_LIMIT_EXCEEDED");
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(60);
                });
    }

    @Test
    void apiBucketCountsEveryRequest() {
        interceptor.preHandle(request("GET"), new MockHttpServletResponse(), new Object());
        interceptor.preHandle(request("GET"), new MockHttpServletResponse(), new Object());
        interceptor.preHandle(request("GET"), new MockHttpServletResponse(), new Object());

        assertThatThrownBy(() -> interceptor.preHandle(request("GET"), new MockHttpServletResponse(), new Object()))
                .isInstanceOf(RetryableProblemException.class);
    }

    @Test
    void disabledLimiterLetsEverythingThrough() {
        RateLimitProperties disabled = new RateLimitProperties(false, Duration.ofMinutes(1), 1, 1);
        Clock clock = Clock.systemUTC();
        RateLimitInterceptor open = new RateLimitInterceptor(
                new FixedWindowRateLimiter(clock, disabled.window()),
                new FixedWindowRateLimiter(clock, disabled.window()),
                disabled
        );

        for (int i = 0; i < 5; i++) {
            assertThat(open.preHandle(request("POST"), new MockHttpServletResponse(), new Object())).isTrue();
        }
    }

    private static MockHttpServletRequest request(String method) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, "/annotations");
        request.setRemoteAddr("10.0.0.1");
        return request;
    }
}
