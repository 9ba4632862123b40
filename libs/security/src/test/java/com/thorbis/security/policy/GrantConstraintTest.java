package com.thorbis.security.policy;

import static org.assertj.core.api.Assertions.assertThat;

import com.thorbis.security.ConstraintCategory;
import com.thorbis.security.DeviceTrust;
import com.thorbis.security.MfaLevel;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GrantConstraint")
class GrantConstraintTest {

    // Monday 2026-03-02 09:00 in Chicago
    private static final Instant MONDAY_MORNING = Instant.parse("2026-03-02T15:00:00Z");

    private static ConstraintInput input(Instant now, String region, MfaLevel mfa, DeviceTrust device,
                                         String assignee, BigDecimal amount) {
        return new ConstraintInput(now, region, mfa, device, "user-1", assignee, amount);
    }

    private static ConstraintInput basic() {
        return input(MONDAY_MORNING, "us-tx", MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null);
    }

    @Test
    @DisplayName("geo scope matches regions case-insensitively and fails without a region")
    void geoScope() {
        GeoScope scope = new GeoScope(List.of("US-TX", "us-ok"));

        assertThat(scope.test(basic())).isTrue();
        assertThat(scope.test(input(MONDAY_MORNING, "us-ca", MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                .isFalse();
        assertThat(scope.test(input(MONDAY_MORNING, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                .isFalse();
        assertThat(scope.category()).isEqualTo(ConstraintCategory.GEO_RESTRICTED);
    }

    @Nested
    @DisplayName("time window")
    class Windows {

        private final TimeWindow businessHours = new TimeWindow(
                List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY), LocalTime.of(8, 0), LocalTime.of(17, 0),
                "America/Chicago");

        @Test
        @DisplayName("holds inside the window on a listed day")
        void inside() {
            assertThat(businessHours.test(basic())).isTrue();
        }

        @Test
        @DisplayName("end is exclusive and unlisted days fail")
        void boundaries() {
            Instant fivePm = Instant.parse("2026-03-02T23:00:00Z");
            Instant sunday = Instant.parse("2026-03-01T15:00:00Z");

            assertThat(businessHours.test(input(fivePm, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                    .isFalse();
            assertThat(businessHours.test(input(sunday, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                    .isFalse();
        }

        @Test
        @DisplayName("overnight windows belong to the day they opened")
        void overnight() {
            TimeWindow nightShift = new TimeWindow(List.of(DayOfWeek.MONDAY), LocalTime.of(22, 0),
                    LocalTime.of(6, 0), "America/Chicago");
            Instant mondayLate = Instant.parse("2026-03-03T04:30:00Z");     // Mon 22:30
            Instant tuesdayEarly = Instant.parse("2026-03-03T10:00:00Z");   // Tue 04:00
            Instant tuesdayLate = Instant.parse("2026-03-04T04:30:00Z");    // Tue 22:30

            assertThat(nightShift.test(input(mondayLate, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                    .isTrue();
            assertThat(nightShift.test(input(tuesdayEarly, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                    .isTrue();
            assertThat(nightShift.test(input(tuesdayLate, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null, null)))
                    .isFalse();
        }

        @Test
        @DisplayName("validates its zone and bounds")
        void validation() {
            assertThat(new TimeWindow(List.of(), LocalTime.NOON, LocalTime.NOON, "Mars/Olympus").validate())
                    .hasSize(2);
        }
    }

    @Test
    @DisplayName("approval ceiling is inclusive and fails when no amount is supplied")
    void approvalCeiling() {
        ApprovalCeiling ceiling = new ApprovalCeiling(new BigDecimal("5000"));

        assertThat(ceiling.test(input(MONDAY_MORNING, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null,
                new BigDecimal("5000.00")))).isTrue();
        assertThat(ceiling.test(input(MONDAY_MORNING, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, null,
                new BigDecimal("7500")))).isFalse();
        assertThat(ceiling.test(basic())).isFalse();
    }

    @Test
    @DisplayName("minimum MFA and device trust compare by strength")
    void strengthLevels() {
        ConstraintInput otp = input(MONDAY_MORNING, null, MfaLevel.OTP, DeviceTrust.RECOGNIZED, null, null);

        assertThat(new MinimumMfa(MfaLevel.OTP).test(otp)).isTrue();
        assertThat(new MinimumMfa(MfaLevel.HARDWARE_KEY).test(otp)).isFalse();
        assertThat(new MinimumDeviceTrust(DeviceTrust.RECOGNIZED).test(otp)).isTrue();
        assertThat(new MinimumDeviceTrust(DeviceTrust.MANAGED).test(otp)).isFalse();
    }

    @Test
    @DisplayName("assigned-to-self requires the caller to be the assignee")
    void assignedToSelf() {
        AssignedToSelf constraint = new AssignedToSelf();

        assertThat(constraint.test(input(MONDAY_MORNING, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, "user-1", null)))
                .isTrue();
        assertThat(constraint.test(input(MONDAY_MORNING, null, MfaLevel.NONE, DeviceTrust.UNKNOWN, "user-2", null)))
                .isFalse();
        assertThat(constraint.test(basic())).isFalse();
    }
}
