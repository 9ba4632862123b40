package com.thorbis.security;

/**
 * How much the platform trusts the device a session runs on. Ordered from weakest to strongest.
 */
public enum DeviceTrust {
    UNKNOWN,
    RECOGNIZED,
    MANAGED;

    public boolean satisfies(DeviceTrust required) {
        return compareTo(required) >= 0;
    }
}
