package com.thorbis.security.principal;

/**
 * Records that a session was used. Implemented by the session manager.
 */
public interface SessionActivity {

    /**
     * Refreshes the session's last activity if it is still active. A session that has already
     * run past its idle or absolute timeout is terminated instead of refreshed.
     */
    void touch(String sessionId);
}
