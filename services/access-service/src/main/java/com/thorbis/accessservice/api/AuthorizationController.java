package com.thorbis.accessservice.api;

import com.thorbis.accessservice.infrastructure.web.CallerResolver;
import com.thorbis.observability.RequestContext;
import com.thorbis.observability.RequestContextHolder;
import com.thorbis.security.SensitivityLevel;
import com.thorbis.security.access.AuthorizationRequest;
import com.thorbis.security.access.AuthorizationResult;
import com.thorbis.security.access.AuthorizationService;
import com.thorbis.security.access.Decision;
import com.thorbis.security.access.ReasonCode;
import com.thorbis.security.access.ResourceRef;
import com.thorbis.security.principal.ResolvedPrincipal;
import jakarta.validation.Valid;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** {@code authorize(principal, tenant, resource, action, context) -> decision} over HTTP. */
@RestController
@RequestMapping("/api/v1")
public class AuthorizationController {

    private final CallerResolver callers;
    private final AuthorizationService authorization;

    public AuthorizationController(CallerResolver callers, AuthorizationService authorization) {
        this.callers = callers;
        this.authorization = authorization;
    }

    /**
     * Allows answer 200. Denials answer 403, or 401 when the session has ended so the front door
     * can send the user back to sign in.
     */
    @PostMapping("/authorize")
    public ResponseEntity<AuthorizeResponse> authorize(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @Valid @RequestBody AuthorizeRequest body) {
        ResolvedPrincipal caller = callers.resolve(authorizationHeader);

        AuthorizationResult result = authorization.authorize(new AuthorizationRequest(
                caller.principal().principalId(),
                caller.sessionId(),
                body.tenantId(),
                toResourceRef(body),
                body.action(),
                body.region(),
                withCorrelation(body.metadata())));

        Decision decision = result.decision();
        if (decision.isAllowed()) {
            return ResponseEntity.ok(AuthorizeResponse.allow(decision.ruleId(), decision.policyVersion(),
                    result.auditSequence()));
        }
        if (decision.reason() == ReasonCode.SESSION_EXPIRED || decision.reason() == ReasonCode.SESSION_REVOKED) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(AuthorizeResponse.deny(decision.reason().value()));
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(AuthorizeResponse.deny(result.publicReason()));
    }

    static ResourceRef toResourceRef(AuthorizeRequest body) {
        AuthorizeRequest.Resource resource = body.resource();
        String owner = resource.tenantId() != null ? resource.tenantId() : body.tenantId();
        return new ResourceRef(owner, resource.type(), resource.id(), sensitivityOf(resource.sensitivity()),
                resource.assignedPrincipalId(), resource.monetaryValue());
    }

    static SensitivityLevel sensitivityOf(String name) {
        if (name == null || name.isBlank()) {
            return SensitivityLevel.INTERNAL;
        }
        try {
            return SensitivityLevel.valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sensitivity '" + name + "'", e);
        }
    }

    static Map<String, String> withCorrelation(Map<String, String> metadata) {
        Map<String, String> merged = new HashMap<>(metadata == null ? Map.of() : metadata);
        merged.values().removeIf(Objects::isNull);
        RequestContextHolder.get().map(RequestContext::correlationId)
                .ifPresent(id -> merged.putIfAbsent("correlationId", id));
        return merged;
    }
}
