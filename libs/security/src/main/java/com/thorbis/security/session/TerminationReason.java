package com.thorbis.security.session;

/** Why a session left the active state. */
public enum TerminationReason {

    LOGOUT("logout"),
    IDLE_TIMEOUT("idle_timeout"),
    EXPIRED("expired"),
    REVOKED("revoked"),
    SUPERSEDED("superseded");

    private final String value;

    TerminationReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
