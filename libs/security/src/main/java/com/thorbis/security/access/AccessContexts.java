package com.thorbis.security.access;

import com.thorbis.observability.RequestContextHolder;
import com.thorbis.security.session.Session;

import java.time.Instant;
import java.util.Map;

/** Builds {@link AccessContext} from live session state. */
public final class AccessContexts {

    private AccessContexts() {
        // utility class
    }

    /**
     * Reads MFA and device trust from the session as it is now, never from a cached copy.
     *
     * @param requestId request id; the current correlation id when null
     */
    public static AccessContext fromSession(Session session, Instant now, String region, String requestId,
                                            Map<String, String> metadata) {
        String id = requestId != null ? requestId : RequestContextHolder.currentCorrelationId();
        return new AccessContext(now, region, session.mfaLevel(), session.deviceTrust(), session.sessionId(), id,
                metadata);
    }
}
