package com.thorbis.security.tenant;

import java.util.Optional;

/**
 * Industry vertical of a tenant. Selects which policy document governs the tenant's roles.
 */
public enum Industry {

    HOME_SERVICES("home_services"),
    RESTAURANT("restaurant"),
    AUTOMOTIVE("automotive"),
    RETAIL("retail"),
    COURSES("courses"),
    PAYROLL("payroll"),
    INVESTIGATIONS("investigations");

    private final String value;

    Industry(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "home_services"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an industry by its canonical value.
     *
     * @return the matching industry, or empty if not found
     */
    public static Optional<Industry> fromString(String value) {
        for (Industry industry : values()) {
            if (industry.value.equals(value)) {
                return Optional.of(industry);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
