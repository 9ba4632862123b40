package com.thorbis.security.isolation;

import com.thorbis.audit.AuditEventType;
import com.thorbis.audit.AuditEvents;
import com.thorbis.audit.AuditOutcome;
import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.AuditResource;
import com.thorbis.audit.AuditSeverity;
import com.thorbis.observability.AccessTracer;
import com.thorbis.security.access.AccessContext;
import com.thorbis.security.access.AccessContexts;
import com.thorbis.security.access.AccessDeniedException;
import com.thorbis.security.access.AccessEvaluator;
import com.thorbis.security.access.Decision;
import com.thorbis.security.access.ReasonCode;
import com.thorbis.security.access.ResourceRef;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.principal.PrincipalResolver;
import com.thorbis.security.session.Session;
import com.thorbis.security.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The only path from business modules to tenant-scoped rows.
 * <p>
 * The tenant predicate is derived from the session, never from the caller. Reading another tenant
 * requires an explicit cross-tenant grant; writing to another tenant is never possible.
 */
public class TenantIsolationGate {

    private static final Logger log = LoggerFactory.getLogger(TenantIsolationGate.class);

    public static final String READ = "read";
    public static final String READ_DELETED = "read_deleted";
    public static final String WRITE = "write";
    public static final String DELETE = "delete";

    private final SessionManager sessions;
    private final PrincipalResolver principals;
    private final AccessEvaluator evaluator;
    private final TenantDataStore store;
    private final AuditRecorder auditRecorder;
    private final Clock clock;
    private final AccessTracer tracer;

    public TenantIsolationGate(SessionManager sessions, PrincipalResolver principals, AccessEvaluator evaluator,
                               TenantDataStore store, AuditRecorder auditRecorder, Clock clock,
                               AccessTracer tracer) {
        this.sessions = sessions;
        this.principals = principals;
        this.evaluator = evaluator;
        this.store = store;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
        this.tracer = tracer;
    }

    /**
     * Reads rows of the session's tenant, or of {@code query.tenantId()} when a cross-tenant grant
     * covers it.
     *
     * @throws TenantMismatchException if another tenant is requested without a covering grant
     * @throws AccessDeniedException   if soft-deleted rows are requested without {@code read_deleted}
     */
    public List<Row> read(String sessionId, ReadQuery query) {
        return tracer.trace("isolation.read", Map.of("isolation.resource_type", query.resourceType()),
                () -> doRead(sessionId, query));
    }

    private List<Row> doRead(String sessionId, ReadQuery query) {
        Session session = sessions.validate(sessionId);
        Instant now = clock.instant();
        String target = query.tenantId() != null ? query.tenantId() : session.tenantId();
        boolean crossTenant = !target.equals(session.tenantId());

        if (crossTenant) {
            Decision decision = authorize(session, target, query.resourceType(), READ, now, true);
            if (!decision.isAllowed()) {
                throw new TenantMismatchException(session.tenantId(), target);
            }
        }
        if (query.includeDeleted()) {
            Decision decision = authorize(session, target, query.resourceType(), READ_DELETED, now, crossTenant);
            if (!decision.isAllowed()) {
                throw new AccessDeniedException(decision);
            }
        }

        TenantPredicate predicate = new TenantPredicate(target);
        List<Row> rows = store.select(predicate, query);
        List<Row> scoped = rows.stream().filter(predicate::matches).collect(Collectors.toList());
        if (scoped.size() != rows.size()) {
            log.error("Store returned {} rows outside tenant {} for {}; dropped", rows.size() - scoped.size(),
                    target, query.resourceType());
        }
        if (crossTenant) {
            auditRecorder.record(AuditEvents.dataAccess(AuditEventType.CROSS_TENANT_READ, target,
                    session.principalId(), sessionId, new AuditResource(query.resourceType(), null), READ, now));
        }
        return scoped;
    }

    /**
     * Creates or replaces a row in the session's tenant.
     *
     * @throws TenantMismatchException if the mutation names another tenant
     * @throws DeletedRowException     if the row is soft-deleted or purge-eligible
     */
    public Row write(String sessionId, Mutation mutation) {
        return tracer.trace("isolation.write", Map.of("isolation.resource_type", mutation.resourceType()), () -> {
            Session session = sessions.validate(sessionId);
            String tenantId = session.tenantId();
            if (mutation.tenantId() != null && !mutation.tenantId().equals(tenantId)) {
                throw new TenantMismatchException(tenantId, mutation.tenantId());
            }
            TenantPredicate predicate = new TenantPredicate(tenantId);
            Instant now = clock.instant();
            Optional<Row> existing = store.find(predicate, mutation.resourceType(), mutation.resourceId());
            if (existing.isPresent() && !existing.get().isActive()) {
                throw new DeletedRowException(mutation.resourceType(), mutation.resourceId(), existing.get().state());
            }
            Instant createdAt = existing.map(Row::createdAt).orElse(now);
            Row stored = store.upsert(predicate, new Row(tenantId, mutation.resourceType(), mutation.resourceId(),
                    mutation.attributes(), RowState.ACTIVE, createdAt, null));
            auditRecorder.record(AuditEvents.dataAccess(AuditEventType.DATA_WRITE, tenantId, session.principalId(),
                    sessionId, new AuditResource(mutation.resourceType(), mutation.resourceId()), WRITE, now));
            return stored;
        });
    }

    /**
     * Soft-deletes a row of the session's tenant.
     *
     * @return false if the row does not exist in that tenant or is already deleted
     */
    public boolean delete(String sessionId, String resourceType, String resourceId) {
        return tracer.trace("isolation.delete", Map.of("isolation.resource_type", resourceType), () -> {
            Session session = sessions.validate(sessionId);
            Instant now = clock.instant();
            boolean deleted = store.markDeleted(new TenantPredicate(session.tenantId()), resourceType, resourceId,
                    now);
            if (deleted) {
                auditRecorder.record(AuditEvents.dataAccess(AuditEventType.DATA_DELETE, session.tenantId(),
                        session.principalId(), session.sessionId(), new AuditResource(resourceType, resourceId),
                        DELETE, now));
            }
            return deleted;
        });
    }

    private Decision authorize(Session session, String tenantId, String resourceType, String action, Instant now,
                               boolean crossTenant) {
        Principal principal = principals.lookup(session.principalId()).orElse(null);
        Decision decision;
        if (principal == null) {
            decision = Decision.deny(ReasonCode.UNAUTHENTICATED, null);
        } else {
            AccessContext context = AccessContexts.fromSession(session, now, principal.homeRegion(), null, Map.of());
            ResourceRef resource = ResourceRef.of(tenantId, resourceType, null);
            decision = crossTenant
                    ? evaluator.authorizeCrossTenant(principal, tenantId, resource, action, context)
                    : evaluator.authorize(principal, tenantId, resource, action, context);
        }
        // recorded in the caller's partition; the target tenant may not exist
        auditRecorder.record(AuditEvents.accessDecision(session.tenantId(), session.principalId(),
                session.sessionId(), new AuditResource(resourceType, null), action, outcomeOf(decision),
                decision.ruleId(), decision.reason().value(), decision.policyVersion(),
                decision.isAllowed() ? AuditSeverity.LOW : AuditSeverity.HIGH,
                Map.of("targetTenant", tenantId), now));
        return decision;
    }

    private static AuditOutcome outcomeOf(Decision decision) {
        return switch (decision.outcome()) {
            case ALLOW -> AuditOutcome.ALLOW;
            case DENY -> AuditOutcome.DENY;
            case POLICY_ERROR -> AuditOutcome.POLICY_ERROR;
        };
    }
}
