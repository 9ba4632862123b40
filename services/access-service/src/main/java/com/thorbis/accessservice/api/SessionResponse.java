package com.thorbis.accessservice.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.thorbis.security.session.Session;
import com.thorbis.security.session.TerminationReason;
import java.time.Instant;

/**
 * Public view of a session.
 *
 * @param sessionId         session id
 * @param principalId       owner
 * @param tenantId          tenant it is bound to
 * @param role              role whose idle timeout applies
 * @param status            {@code ACTIVE} or {@code TERMINATED}
 * @param mfaLevel          strongest second factor satisfied
 * @param deviceTrust       device trust level
 * @param createdAt         creation time
 * @param lastActivityAt    last authorized use
 * @param expiresAt         absolute expiry
 * @param idleTimeout       ISO-8601 idle timeout
 * @param terminationReason why it ended, absent while active
 * @param token             bearer token, only in the response that created the session
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        String sessionId,
        String principalId,
        String tenantId,
        String role,
        String status,
        String mfaLevel,
        String deviceTrust,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        String idleTimeout,
        String terminationReason,
        String token) {

    static SessionResponse from(Session session) {
        return from(session, null);
    }

    static SessionResponse from(Session session, String token) {
        Session.State state = session.state();
        return new SessionResponse(
                session.sessionId(),
                session.principalId(),
                session.tenantId(),
                session.role(),
                state.status().name(),
                state.mfaLevel().name(),
                state.deviceTrust().name(),
                session.createdAt(),
                state.lastActivityAt(),
                session.expiresAt(),
                session.idleTimeout().toString(),
                session.terminationReason().map(TerminationReason::value).orElse(null),
                token);
    }
}
