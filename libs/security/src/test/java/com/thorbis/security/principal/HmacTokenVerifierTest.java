package com.thorbis.security.principal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.thorbis.security.testing.MutableClock;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for HmacTokenVerifier.
 *
 * <p>WHY: Verify that forged, expired and malformed tokens are rejected.
 */
@DisplayName("HmacTokenVerifier")
class HmacTokenVerifierTest {

    private static final byte[] SECRET = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final HmacTokenVerifier verifier = new HmacTokenVerifier(SECRET, clock);

    @Test
    @DisplayName("verifies a token it issued")
    void issuedTokenVerifies() {
        String token = verifier.issue("user-1", "session-1", NOW.plus(Duration.ofHours(1)));

        assertThat(verifier.verify(token)).get()
                .satisfies(v -> {
                    assertThat(v.principalId()).isEqualTo("user-1");
                    assertThat(v.sessionId()).isEqualTo("session-1");
                });
    }

    @Test
    @DisplayName("rejects expired tokens")
    void expired() {
        String token = verifier.issue("user-1", "session-1", NOW.plus(Duration.ofMinutes(5)));
        clock.advance(Duration.ofMinutes(5));

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("rejects tokens signed with another secret")
    void forged() {
        HmacTokenVerifier other = new HmacTokenVerifier(
                "another-secret-another-secret-xx".getBytes(StandardCharsets.UTF_8), clock);
        String token = other.issue("user-1", "session-1", NOW.plus(Duration.ofHours(1)));

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("rejects tampered and malformed tokens")
    void malformed() {
        String token = verifier.issue("user-1", "session-1", NOW.plus(Duration.ofHours(1)));
        String tampered = "x" + token.substring(1);

        assertThat(verifier.verify(tampered)).isEmpty();
        assertThat(verifier.verify("no-dot")).isEmpty();
        assertThat(verifier.verify("a.b.c")).isEmpty();
        assertThat(verifier.verify("!!!.???")).isEmpty();
        assertThat(verifier.verify(null)).isEmpty();
    }

    @Test
    @DisplayName("requires a 32-byte secret")
    void shortSecret() {
        assertThatThrownBy(() -> new HmacTokenVerifier(new byte[16], clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
