package com.thorbis.security.session;

/** A session can no longer be used. */
public abstract class SessionException extends RuntimeException {

    private final String sessionId;

    protected SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
