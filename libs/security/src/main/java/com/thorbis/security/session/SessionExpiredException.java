package com.thorbis.security.session;

/**
 * Thrown when a session has ended through logout or a timeout, or is unknown.
 */
public class SessionExpiredException extends SessionException {

    public SessionExpiredException(String sessionId, String detail) {
        super(sessionId, "Session " + sessionId + " expired: " + detail);
    }
}
