package com.thorbis.security;

/**
 * Strength of the second factor a session has satisfied. Ordered from weakest to strongest.
 */
public enum MfaLevel {
    NONE,
    OTP,
    HARDWARE_KEY;

    /** Whether this level meets or exceeds {@code required}. */
    public boolean satisfies(MfaLevel required) {
        return compareTo(required) >= 0;
    }
}
