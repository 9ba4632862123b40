package com.thorbis.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for AuditEventValidator.
 *
 * <p>WHY: Verify that validation reports every missing field at once.
 */
@DisplayName("AuditEventValidator")
class AuditEventValidatorTest {

    @Nested
    @DisplayName("valid events")
    class ValidEvents {

        @Test
        @DisplayName("factory-built access decision passes")
        void accessDecisionValid() {
            var result = AuditEventValidator.validate(
                    AuditTestEvents.decision("tenant-a", AuditOutcome.ALLOW));
            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("session lifecycle event needs no caller resource")
        void sessionEventValid() {
            var event = AuditEvents.sessionLifecycle(AuditEventType.SESSION_TERMINATED,
                    "tenant-a", "user-1", "sess-1", "logout", AuditTestEvents.NOW);
            assertThat(AuditEventValidator.validate(event).valid()).isTrue();
        }

        @Test
        @DisplayName("policy reload lands in the platform partition")
        void policyReloadValid() {
            var event = AuditEvents.policyReload("admin-1", "2026.04", false,
                    "role cycle", AuditTestEvents.NOW);
            assertThat(event.tenantId()).isEqualTo(AuditEvents.PLATFORM_TENANT);
            assertThat(event.eventType()).isEqualTo(AuditEventType.POLICY_RELOAD_REJECTED);
            assertThat(AuditEventValidator.validate(event).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("missing fields")
    class MissingFields {

        @Test
        @DisplayName("null event fails")
        void nullEvent() {
            assertThat(AuditEventValidator.validate(null).valid()).isFalse();
        }

        @Test
        @DisplayName("access decision without resource, action or reason reports every error")
        void collectsAllErrors() {
            var event = new AuditEvent(AuditEventType.ACCESS_DECISION, AuditSeverity.LOW,
                    " ", "user-1", null, null, null, AuditOutcome.DENY, null, null, null,
                    Map.of(), AuditTestEvents.NOW);
            var result = AuditEventValidator.validate(event);
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(4);
            assertThat(result.errors()).anyMatch(e -> e.contains("tenantId"));
            assertThat(result.errors()).anyMatch(e -> e.contains("action"));
            assertThat(result.errors()).anyMatch(e -> e.contains("resource"));
            assertThat(result.errors()).anyMatch(e -> e.contains("reasonCode"));
        }
    }
}
