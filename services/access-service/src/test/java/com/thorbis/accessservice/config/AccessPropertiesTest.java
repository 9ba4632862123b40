package com.thorbis.accessservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for AccessProperties binding.
 *
 * <p>WHY: Verify that omitted sections get defaults and a short token secret is refused.
 */
@DisplayName("AccessProperties")
class AccessPropertiesTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("fills defaults for omitted sections")
    void defaults() {
        var props = new AccessProperties("access-service", null, SECRET, null, null,
                new AccessProperties.Policy(null, "2026.03"), null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.operatorPrincipals()).isEmpty();
        assertThat(props.seedLocation()).isEqualTo("classpath:seed/directory.json");
        assertThat(props.policy().location()).isEqualTo("policies");
        assertThat(props.audit().sensitivityThreshold()).isEqualTo("FINANCIAL");
        assertThat(props.audit().syncTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.session().maxConcurrent()).isEqualTo(5);
        assertThat(props.session().maxLifetime()).isEqualTo(Duration.ofHours(8));
    }

    @Test
    @DisplayName("rejects a token secret shorter than 32 bytes")
    void shortSecret() {
        assertThatThrownBy(() -> new AccessProperties("access-service", "test", "too-short", null, null,
                new AccessProperties.Policy(null, "2026.03"), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("token-secret");
    }

    @Test
    @DisplayName("exposes the secret as UTF-8 bytes")
    void secretBytes() {
        var props = new AccessProperties("access-service", "test", SECRET, null, null,
                new AccessProperties.Policy(null, "2026.03"), null, null);

        assertThat(props.tokenSecretBytes()).hasSize(32);
    }
}
