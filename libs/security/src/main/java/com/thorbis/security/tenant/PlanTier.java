package com.thorbis.security.tenant;

import java.util.Optional;

/**
 * Subscription tier of a tenant.
 */
public enum PlanTier {

    STARTER("starter"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise");

    private final String value;

    PlanTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PlanTier> fromString(String value) {
        for (PlanTier tier : values()) {
            if (tier.value.equals(value)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
