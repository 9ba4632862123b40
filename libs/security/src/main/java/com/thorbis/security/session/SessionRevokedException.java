package com.thorbis.security.session;

/** Thrown when a session was forcibly revoked or superseded. */
public class SessionRevokedException extends SessionException {

    public SessionRevokedException(String sessionId) {
        super(sessionId, "Session " + sessionId + " was revoked");
    }
}
