package com.thorbis.security.access;

import com.thorbis.audit.AuditEvent;
import com.thorbis.audit.AuditEvents;
import com.thorbis.audit.AuditOutcome;
import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.AuditResource;
import com.thorbis.audit.AuditSeverity;
import com.thorbis.audit.AuditWriteFailedException;
import com.thorbis.observability.AccessTracer;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.principal.PrincipalResolver;
import com.thorbis.security.session.Session;
import com.thorbis.security.session.SessionExpiredException;
import com.thorbis.security.session.SessionManager;
import com.thorbis.security.session.SessionRevokedException;
import com.thorbis.security.tenant.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code authorize} entry point used by business modules.
 * <p>
 * Each call validates the session, re-reads the principal from the directory (nothing is cached
 * per session, so role changes and revocations apply to the next call), evaluates, and records
 * exactly one audit entry. Sensitive denials wait for the audit store; see
 * {@link AuditDurabilityPolicy}.
 */
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final PrincipalResolver principals;
    private final SessionManager sessions;
    private final AccessEvaluator evaluator;
    private final TenantRegistry tenants;
    private final AuditRecorder auditRecorder;
    private final AuditDurabilityPolicy durability;
    private final AccessTracer tracer;
    private final Clock clock;

    public AuthorizationService(PrincipalResolver principals, SessionManager sessions, AccessEvaluator evaluator,
                                TenantRegistry tenants, AuditRecorder auditRecorder,
                                AuditDurabilityPolicy durability, AccessTracer tracer, Clock clock) {
        this.principals = principals;
        this.sessions = sessions;
        this.evaluator = evaluator;
        this.tenants = tenants;
        this.auditRecorder = auditRecorder;
        this.durability = durability;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException  if the request has no resource or action
     * @throws AuditWriteFailedException if a decision that must be durably audited was not
     *                                   acknowledged in time; the entry stays buffered
     */
    public AuthorizationResult authorize(AuthorizationRequest request) {
        if (request.resource() == null || request.action() == null || request.action().isBlank()) {
            throw new IllegalArgumentException("resource and action are required");
        }
        Map<String, String> attributes = Map.of(
                "access.action", request.action(),
                "access.resource_type", request.resource().resourceType(),
                "access.tenant", String.valueOf(request.tenantId()));
        return tracer.trace("access.authorize", attributes, () -> doAuthorize(request));
    }

    private AuthorizationResult doAuthorize(AuthorizationRequest request) {
        Instant now = clock.instant();
        Decision decision;
        Session session = null;
        try {
            session = sessions.validate(request.sessionId());
            decision = evaluateWithSession(request, session, now);
        } catch (SessionRevokedException e) {
            decision = Decision.deny(ReasonCode.SESSION_REVOKED, null);
        } catch (SessionExpiredException e) {
            decision = Decision.deny(ReasonCode.SESSION_EXPIRED, null);
        }

        if (decision.isAllowed() && session != null && !session.isActive()) {
            // revoked while evaluating
            decision = Decision.deny(ReasonCode.SESSION_REVOKED, decision.policyVersion());
        }

        long sequence = audit(request, decision, now);
        if (decision.isAllowed()) {
            sessions.touch(request.sessionId());
        }
        return new AuthorizationResult(decision, decision.publicReason(), sequence);
    }

    private Decision evaluateWithSession(AuthorizationRequest request, Session session, Instant now) {
        if (!session.principalId().equals(request.principalId())) {
            log.warn("Session {} does not belong to principal {}", session.sessionId(), request.principalId());
            return Decision.deny(ReasonCode.UNAUTHENTICATED, null);
        }
        Optional<Principal> principal = principals.lookup(request.principalId());
        if (principal.isEmpty()) {
            return Decision.deny(ReasonCode.UNAUTHENTICATED, null);
        }
        AccessContext context = AccessContexts.fromSession(session, now,
                request.region() != null ? request.region() : principal.get().homeRegion(),
                null, request.metadata());
        return evaluator.authorize(principal.get(), request.tenantId(), request.resource(), request.action(),
                context);
    }

    /** @return sequence number of the decision's audit entry */
    private long audit(AuthorizationRequest request, Decision decision, Instant now) {
        // unknown tenants get no partition of their own
        String partition = tenants.find(request.tenantId()).isPresent()
                ? request.tenantId()
                : AuditEvents.PLATFORM_TENANT;
        ResourceRef resource = request.resource();
        AuditEvent event = AuditEvents.accessDecision(partition, request.principalId(), request.sessionId(),
                new AuditResource(resource.resourceType(), resource.resourceId()),
                request.action(), outcomeOf(decision), decision.ruleId(), decision.reason().value(),
                decision.policyVersion(), severityOf(decision, resource, request.action()),
                withFailedConstraint(request.metadata(), decision), now);

        if (durability.requiresSync(decision, resource, request.action())) {
            try {
                return auditRecorder.recordDurably(event, durability.syncTimeout()).sequence();
            } catch (AuditWriteFailedException e) {
                log.error("Sensitive denial for {} on {} not durably audited within {}; entry {} stays buffered",
                        request.principalId(), resource.resourceType(), durability.syncTimeout(), e.sequence());
                throw e;
            }
        }
        return auditRecorder.record(event).sequence();
    }

    private AuditSeverity severityOf(Decision decision, ResourceRef resource, String action) {
        return switch (decision.outcome()) {
            case ALLOW -> AuditSeverity.LOW;
            case POLICY_ERROR -> AuditSeverity.HIGH;
            case DENY -> decision.reason() == ReasonCode.NO_TENANT_BINDING
                    || decision.reason() == ReasonCode.SESSION_REVOKED
                    || durability.isCritical(resource, action)
                    ? AuditSeverity.HIGH
                    : AuditSeverity.MEDIUM;
        };
    }

    private static AuditOutcome outcomeOf(Decision decision) {
        return switch (decision.outcome()) {
            case ALLOW -> AuditOutcome.ALLOW;
            case DENY -> AuditOutcome.DENY;
            case POLICY_ERROR -> AuditOutcome.POLICY_ERROR;
        };
    }

    private static Map<String, String> withFailedConstraint(Map<String, String> metadata, Decision decision) {
        if (decision.failedConstraint() == null) {
            return metadata;
        }
        Map<String, String> enriched = new HashMap<>(metadata);
        enriched.put("failedConstraint", decision.failedConstraint().value());
        return enriched;
    }
}
