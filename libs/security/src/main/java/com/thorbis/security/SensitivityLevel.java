package com.thorbis.security;

import java.util.Optional;

/**
 * Resource-intrinsic sensitivity ranking (1-6).
 * <p>
 * Each level carries the minimum MFA level and device trust a context must have before any grant
 * can Allow access, independent of role.
 */
public enum SensitivityLevel {

    PUBLIC(1, MfaLevel.NONE, DeviceTrust.UNKNOWN),
    INTERNAL(2, MfaLevel.NONE, DeviceTrust.UNKNOWN),
    CONFIDENTIAL(3, MfaLevel.NONE, DeviceTrust.UNKNOWN),
    PERSONAL(4, MfaLevel.NONE, DeviceTrust.RECOGNIZED),
    FINANCIAL(5, MfaLevel.OTP, DeviceTrust.UNKNOWN),
    CRITICAL(6, MfaLevel.HARDWARE_KEY, DeviceTrust.MANAGED);

    private final int level;
    private final MfaLevel requiredMfa;
    private final DeviceTrust requiredDeviceTrust;

    SensitivityLevel(int level, MfaLevel requiredMfa, DeviceTrust requiredDeviceTrust) {
        this.level = level;
        this.requiredMfa = requiredMfa;
        this.requiredDeviceTrust = requiredDeviceTrust;
    }

    public int level() {
        return level;
    }

    public MfaLevel requiredMfa() {
        return requiredMfa;
    }

    public DeviceTrust requiredDeviceTrust() {
        return requiredDeviceTrust;
    }

    public boolean isAtLeast(SensitivityLevel other) {
        return level >= other.level;
    }

    /**
     * Looks up a sensitivity by its numeric level.
     *
     * @return the matching level, or empty if outside 1-6
     */
    public static Optional<SensitivityLevel> fromLevel(int level) {
        for (SensitivityLevel candidate : values()) {
            if (candidate.level == level) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
