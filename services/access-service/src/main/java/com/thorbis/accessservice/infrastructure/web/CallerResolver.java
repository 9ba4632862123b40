package com.thorbis.accessservice.infrastructure.web;

import com.thorbis.accessservice.config.AccessProperties;
import com.thorbis.observability.RequestContext;
import com.thorbis.observability.RequestContextHolder;
import com.thorbis.security.access.AccessDeniedException;
import com.thorbis.security.access.Decision;
import com.thorbis.security.access.ReasonCode;
import com.thorbis.security.principal.PrincipalResolver;
import com.thorbis.security.principal.ResolvedPrincipal;
import com.thorbis.security.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an {@code Authorization} header into a {@link ResolvedPrincipal} and records the caller
 * on the current {@link RequestContext}.
 */
@Component
public class CallerResolver {

    private static final Logger log = LoggerFactory.getLogger(CallerResolver.class);

    private final PrincipalResolver principals;
    private final SessionManager sessions;
    private final AccessProperties properties;

    public CallerResolver(PrincipalResolver principals, SessionManager sessions,
            AccessProperties properties) {
        this.principals = principals;
        this.sessions = sessions;
        this.properties = properties;
    }

    /**
     * @throws com.thorbis.security.principal.UnauthenticatedException if the header carries no
     *     valid token for a known principal
     */
    public ResolvedPrincipal resolve(String authorization) {
        ResolvedPrincipal caller = principals.resolve(authorization);
        String tenantId = sessions.find(caller.sessionId()).map(s -> s.tenantId()).orElse(null);
        RequestContextHolder.get().ifPresent(ctx -> RequestContextHolder.set(
                ctx.withCaller(tenantId, caller.principal().principalId(), caller.sessionId())));
        return caller;
    }

    /** Resolves the caller and requires it to be a configured operator principal. */
    public ResolvedPrincipal resolveOperator(String authorization) {
        ResolvedPrincipal caller = resolve(authorization);
        if (!isOperator(caller)) {
            log.warn("Principal {} attempted an operator action", caller.principal().principalId());
            throw new AccessDeniedException(Decision.deny(ReasonCode.NO_GRANT, null));
        }
        return caller;
    }

    public boolean isOperator(ResolvedPrincipal caller) {
        return properties.operatorPrincipals().contains(caller.principal().principalId());
    }
}
