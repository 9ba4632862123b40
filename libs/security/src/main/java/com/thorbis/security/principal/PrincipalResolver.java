package com.thorbis.security.principal;

import com.thorbis.security.tenant.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns an authenticated caller into a {@link Principal}.
 * <p>
 * Bindings to tenants that are missing or not active are dropped. A caller asking about a tenant
 * outside its bindings is still resolved; the evaluator denies it, so the attempt is audited.
 */
public class PrincipalResolver {

    private static final Logger log = LoggerFactory.getLogger(PrincipalResolver.class);
    private static final String BEARER = "bearer";

    private final TokenVerifier verifier;
    private final PrincipalDirectory directory;
    private final TenantRegistry tenants;
    private final SessionActivity sessionActivity;

    public PrincipalResolver(TokenVerifier verifier, PrincipalDirectory directory,
                             TenantRegistry tenants, SessionActivity sessionActivity) {
        this.verifier = verifier;
        this.directory = directory;
        this.tenants = tenants;
        this.sessionActivity = sessionActivity;
    }

    /**
     * Resolves an {@code Authorization} header value or a raw token.
     *
     * @throws UnauthenticatedException if the token is missing, forged or expired, or the
     *                                  principal is unknown
     */
    public ResolvedPrincipal resolve(String authorization) {
        String token = extractToken(authorization)
                .orElseThrow(() -> new UnauthenticatedException("missing bearer token"));
        VerifiedToken verified = verifier.verify(token)
                .orElseThrow(() -> new UnauthenticatedException("token failed verification"));
        Principal principal = lookup(verified.principalId())
                .orElseThrow(() -> new UnauthenticatedException(
                        "unknown principal " + verified.principalId()));
        sessionActivity.touch(verified.sessionId());
        return new ResolvedPrincipal(principal, verified.sessionId());
    }

    /**
     * Reads the principal's current bindings from the directory. Called on every authorization
     * so role changes and revocations apply immediately.
     */
    public Optional<Principal> lookup(String principalId) {
        Optional<Principal> found = directory.find(principalId);
        if (found.isEmpty()) {
            log.debug("Principal {} not found in directory", principalId);
        }
        return found.map(p -> p.withBindings(b -> tenants.isActive(b.tenantId())));
    }

    /** Accepts {@code "Bearer <token>"} (any case) or the bare token. */
    static Optional<String> extractToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorization.strip();
        if (trimmed.toLowerCase(Locale.ROOT).equals(BEARER)) {
            return Optional.empty();
        }
        if (trimmed.length() > BEARER.length()
                && trimmed.regionMatches(true, 0, BEARER, 0, BEARER.length())
                && Character.isWhitespace(trimmed.charAt(BEARER.length()))) {
            return Optional.of(trimmed.substring(BEARER.length()).strip());
        }
        return Optional.of(trimmed);
    }
}
