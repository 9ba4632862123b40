package com.thorbis.security;

/**
 * Category of a failed contextual requirement.
 * <p>
 * Callers only ever see the category, never the configured value (region list, ceiling amount),
 * so a denial cannot be used as an oracle for policy contents. The category is enough to prompt
 * for step-up authentication or a trusted device.
 */
public enum ConstraintCategory {

    GEO_RESTRICTED("geo_restricted"),
    OUTSIDE_TIME_WINDOW("outside_time_window"),
    MFA_REQUIRED("mfa_required"),
    TRUSTED_DEVICE_REQUIRED("trusted_device_required"),
    APPROVAL_CEILING("approval_ceiling"),
    ASSIGNMENT_REQUIRED("assignment_required");

    private final String value;

    ConstraintCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
