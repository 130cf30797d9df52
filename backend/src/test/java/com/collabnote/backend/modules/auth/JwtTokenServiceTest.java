package com.collabnote.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import com.collabnote.backend.modules.auth.application.JwtTokenService;
import com.collabnote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.collabnote.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.collabnote.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-collabnote-secret-0123456789abcdef";

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);
    private final JwtTokenService service = new JwtTokenService(new JwtTokenProvider(SECRET), 60_000L, clock);

    @Test
    void issuedTokenParsesBackToSameIdentity() {
        String token = service.issueAccessToken(42L, "alice", List.of("USER"));

        ParsedToken parsed = service.parseAccessToken(token);

        assertThat(parsed.userId()).isEqualTo(42L);
        assertThat(parsed.loginId()).isEqualTo("alice");
        assertThat(parsed.roles()).containsExactly("USER");
        assertThat(parsed.expiresAt().toInstant()).isEqualTo(Instant.parse("2025-03-01T09:01:00Z"));
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-collabnote-secret-0123456789abcdef"),
                60_000L,
                clock
        );
        String foreign = other.issueAccessToken(1L, "mallory", List.of());

        assertThatThrownBy(() -> service.parseAccessToken(foreign)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void expiredTokenIsRejected() {
        JwtTokenService past = new JwtTokenService(
                new JwtTokenProvider(SECRET),
                60_000L,
                Clock.fixed(Instant.parse("2025-03-01T08:00:00Z"), ZoneOffset.UTC)
        );
        String stale = past.issueAccessToken(1L, "bob", List.of());

        assertThatThrownBy(() -> service.parseAccessToken(stale)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> service.parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("short"))
                .isInstanceOf(IllegalStateException.class);
    }
}
