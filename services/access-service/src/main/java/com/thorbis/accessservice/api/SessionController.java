package com.thorbis.accessservice.api;

import com.thorbis.accessservice.infrastructure.web.CallerResolver;
import com.thorbis.security.DeviceTrust;
import com.thorbis.security.MfaLevel;
import com.thorbis.security.access.AccessDeniedException;
import com.thorbis.security.access.AuthorizationRequest;
import com.thorbis.security.access.AuthorizationResult;
import com.thorbis.security.access.AuthorizationService;
import com.thorbis.security.access.Decision;
import com.thorbis.security.access.ReasonCode;
import com.thorbis.security.access.ResourceRef;
import com.thorbis.security.principal.HmacTokenVerifier;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.principal.PrincipalResolver;
import com.thorbis.security.principal.ResolvedPrincipal;
import com.thorbis.security.session.Session;
import com.thorbis.security.session.SessionManager;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session lifecycle for the authentication front door.
 *
 * <p>Opening a session and stepping it up are operator actions: the front door verifies credentials
 * and second factors, this service only records the result. Heartbeat and logout are for the
 * session's own bearer. Revocation is open to operators, and to tenant administrators holding
 * {@code session:revoke} for sessions in their own tenant.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    static final String SESSION_RESOURCE = "session";
    static final String REVOKE = "revoke";
    static final String OPERATOR_REVOCATION = "operator_revocation";

    private final CallerResolver callers;
    private final SessionManager sessions;
    private final PrincipalResolver principals;
    private final HmacTokenVerifier tokens;
    private final AuthorizationService authorization;

    public SessionController(CallerResolver callers, SessionManager sessions, PrincipalResolver principals,
            HmacTokenVerifier tokens, AuthorizationService authorization) {
        this.callers = callers;
        this.sessions = sessions;
        this.principals = principals;
        this.tokens = tokens;
        this.authorization = authorization;
    }

    @PostMapping
    public ResponseEntity<SessionResponse> create(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @Valid @RequestBody CreateSessionRequest body) {
        callers.resolveOperator(authorizationHeader);
        Principal principal = principals.lookup(body.principalId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown principal " + body.principalId()));

        Session session = sessions.create(principal, body.tenantId(),
                parse(MfaLevel.class, body.mfaLevel(), MfaLevel.NONE),
                parse(DeviceTrust.class, body.deviceTrust(), DeviceTrust.UNKNOWN));
        String token = tokens.issue(session.principalId(), session.sessionId(), session.expiresAt());
        return ResponseEntity.created(URI.create("/api/v1/sessions/" + session.sessionId()))
                .body(SessionResponse.from(session, token));
    }

    @PostMapping("/{sessionId}/heartbeat")
    public SessionResponse heartbeat(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @PathVariable String sessionId) {
        requireOwner(callers.resolve(authorizationHeader), sessionId);
        return SessionResponse.from(sessions.heartbeat(sessionId));
    }

    @PostMapping("/{sessionId}/step-up")
    public SessionResponse stepUp(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @PathVariable String sessionId,
            @Valid @RequestBody StepUpRequest body) {
        ResolvedPrincipal operator = callers.resolveOperator(authorizationHeader);
        MfaLevel level = parse(MfaLevel.class, body.mfaLevel(), MfaLevel.NONE);
        Session session = sessions.validate(sessionId);
        boolean enrolled = principals.lookup(session.principalId()).map(Principal::mfaEnrolled).orElse(false);
        if (level != MfaLevel.NONE && !enrolled) {
            throw new IllegalArgumentException("No second factor enrolled");
        }
        log.info("{} stepped up session {} to {}", operator.principal().principalId(), sessionId, level);
        return SessionResponse.from(sessions.stepUp(sessionId, level));
    }

    /** Logout for the session's owner, forced revocation for an operator. */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> end(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @PathVariable String sessionId,
            @RequestParam(required = false) String reason) {
        ResolvedPrincipal caller = callers.resolve(authorizationHeader);
        if (sessionId.equals(caller.sessionId())) {
            sessions.logout(sessionId);
        } else if (callers.isOperator(caller)) {
            sessions.revoke(sessionId, reason != null ? reason : OPERATOR_REVOCATION);
        } else {
            throw notAuthorized();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/revocations")
    public Map<String, Integer> revokeAll(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @RequestBody RevocationRequest body) {
        ResolvedPrincipal caller = callers.resolve(authorizationHeader);
        String reason = body.reason() != null ? body.reason() : OPERATOR_REVOCATION;
        if (!callers.isOperator(caller)) {
            if (body.tenantId() == null) {
                throw notAuthorized();
            }
            requireRevokeGrant(caller, body.tenantId());
        }
        int revoked = sessions.revokeAll(body.principalId(), body.tenantId(), reason);
        log.info("{} revoked {} sessions (principal={}, tenant={})", caller.principal().principalId(), revoked,
                body.principalId(), body.tenantId());
        return Map.of("revoked", revoked);
    }

    private void requireRevokeGrant(ResolvedPrincipal caller, String tenantId) {
        AuthorizationResult result = authorization.authorize(new AuthorizationRequest(
                caller.principal().principalId(),
                caller.sessionId(),
                tenantId,
                ResourceRef.of(tenantId, SESSION_RESOURCE, null),
                REVOKE,
                null,
                AuthorizationController.withCorrelation(Map.of())));
        if (!result.isAllowed()) {
            throw new AccessDeniedException(result.decision());
        }
    }

    private static void requireOwner(ResolvedPrincipal caller, String sessionId) {
        if (!sessionId.equals(caller.sessionId())) {
            throw notAuthorized();
        }
    }

    private static AccessDeniedException notAuthorized() {
        return new AccessDeniedException(Decision.deny(ReasonCode.NO_GRANT, null));
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value, E fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " '" + value + "'", e);
        }
    }
}
