package com.thorbis.security.session;

import com.thorbis.audit.AuditEventType;
import com.thorbis.audit.AuditEvents;
import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.AuditWriteFailedException;
import com.thorbis.observability.AccessMetrics;
import com.thorbis.security.DeviceTrust;
import com.thorbis.security.MfaLevel;
import com.thorbis.security.policy.IndustryPolicy;
import com.thorbis.security.policy.PolicySnapshot;
import com.thorbis.security.policy.PolicyStore;
import com.thorbis.security.principal.BindingChangeListener;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.principal.SessionActivity;
import com.thorbis.security.principal.TenantBinding;
import com.thorbis.security.tenant.Tenant;
import com.thorbis.security.tenant.TenantRegistry;
import com.thorbis.security.tenant.TenantStatus;
import com.thorbis.security.tenant.TenantStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns session lifecycle: {@code ACTIVE -> TERMINATED(logout | idle_timeout | expired | revoked |
 * superseded)}.
 * <p>
 * Sessions are indexed by principal and by tenant so bulk revocation does not scan. Only the call
 * that wins the status flip writes the audit entry, so each session has exactly one termination on
 * record. A forced revocation does not return until its entry is durably recorded.
 * <p>
 * A tenant leaving ACTIVE revokes all of its sessions. A principal whose binding to a tenant is
 * removed or changed loses its sessions in that tenant, since a session carries the role it was
 * opened with.
 */
public class SessionManager implements SessionActivity, TenantStatusListener, BindingChangeListener {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionPolicy policy;
    private final PolicyStore policyStore;
    private final TenantRegistry tenants;
    private final AuditRecorder auditRecorder;
    private final Duration revocationAuditTimeout;
    private final Clock clock;
    private final AccessMetrics metrics;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byPrincipal = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byTenant = new ConcurrentHashMap<>();

    public SessionManager(SessionPolicy policy, PolicyStore policyStore, TenantRegistry tenants,
                          AuditRecorder auditRecorder, Duration revocationAuditTimeout, Clock clock,
                          AccessMetrics metrics) {
        this.policy = policy;
        this.policyStore = policyStore;
        this.tenants = tenants;
        this.auditRecorder = auditRecorder;
        this.revocationAuditTimeout = revocationAuditTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Opens a session for a principal against one of its bound tenants.
     *
     * @throws IllegalArgumentException if the principal is not bound to an active tenant of that
     *                                  id, or claims MFA it has not enrolled
     */
    public Session create(Principal principal, String tenantId, MfaLevel mfaLevel, DeviceTrust deviceTrust) {
        TenantBinding binding = principal.bindingFor(tenantId)
                .filter(b -> tenants.isActive(b.tenantId()))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Principal " + principal.principalId() + " cannot open a session for this tenant"));
        if (mfaLevel != MfaLevel.NONE && !principal.mfaEnrolled()) {
            throw new IllegalArgumentException(
                    "Principal " + principal.principalId() + " has no second factor enrolled");
        }

        Instant now = clock.instant();
        supersedeOldest(principal.principalId());

        String role = binding.mostSpecificRole();
        Duration idleTimeout = policy.defaultIdleTimeout();
        Optional<IndustryPolicy> industryPolicy = industryPolicyFor(tenantId);
        if (industryPolicy.isPresent()) {
            IndustryPolicy ip = industryPolicy.get();
            Optional<Duration> specific = ip.idleTimeoutFor(binding.industryRole());
            if (specific.isPresent()) {
                role = binding.industryRole();
                idleTimeout = specific.get();
            } else {
                Optional<Duration> base = ip.idleTimeoutFor(binding.baseRole());
                if (base.isPresent()) {
                    role = binding.baseRole();
                    idleTimeout = base.get();
                }
            }
        }

        Session session = new Session(UUID.randomUUID().toString(), principal.principalId(), tenantId,
                role, now, now.plus(policy.maxLifetime()), idleTimeout, mfaLevel, deviceTrust);
        sessions.put(session.sessionId(), session);
        byPrincipal.computeIfAbsent(session.principalId(), k -> ConcurrentHashMap.newKeySet()).add(session.sessionId());
        byTenant.computeIfAbsent(tenantId, k -> ConcurrentHashMap.newKeySet()).add(session.sessionId());

        auditRecorder.record(AuditEvents.sessionLifecycle(AuditEventType.SESSION_CREATED, tenantId,
                principal.principalId(), session.sessionId(), role, now));
        log.info("Session {} opened for {} in tenant {} (role {}, idle timeout {})",
                session.sessionId(), principal.principalId(), tenantId, role, idleTimeout);
        return session;
    }

    /**
     * Returns the session if it is usable now. A session found past its timeout is terminated
     * here.
     *
     * @throws SessionRevokedException if the session was revoked
     * @throws SessionExpiredException if it ended any other way or is unknown
     */
    public Session validate(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionExpiredException(sessionId, "unknown session");
        }
        if (session.isActive()) {
            Optional<TerminationReason> timeout = session.timeoutAt(clock.instant());
            if (timeout.isEmpty()) {
                return session;
            }
            end(session, timeout.get(), timeout.get().value());
        }
        TerminationReason reason = session.terminationReason().orElse(TerminationReason.EXPIRED);
        if (reason == TerminationReason.REVOKED) {
            throw new SessionRevokedException(sessionId);
        }
        throw new SessionExpiredException(sessionId, reason.value());
    }

    /** Refreshes activity on a valid session. */
    public Session heartbeat(String sessionId) {
        Session session = validate(sessionId);
        if (!session.touch(clock.instant())) {
            return validate(sessionId);
        }
        return session;
    }

    @Override
    public void touch(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null || !session.isActive()) {
            return;
        }
        Instant now = clock.instant();
        Optional<TerminationReason> timeout = session.timeoutAt(now);
        if (timeout.isPresent()) {
            end(session, timeout.get(), timeout.get().value());
        } else {
            session.touch(now);
        }
    }

    /** Records that the session satisfied a stronger second factor. */
    public Session stepUp(String sessionId, MfaLevel level) {
        Session session = validate(sessionId);
        session.stepUp(level, clock.instant());
        log.info("Session {} stepped up to {}", sessionId, session.mfaLevel());
        return validate(sessionId);
    }

    /** Ends a session at its owner's request. Returns false if it had already ended. */
    public boolean logout(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionExpiredException(sessionId, "unknown session");
        }
        return end(session, TerminationReason.LOGOUT, TerminationReason.LOGOUT.value());
    }

    /** Forcibly ends one session. Returns false if it had already ended. */
    public boolean revoke(String sessionId, String reason) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionExpiredException(sessionId, "unknown session");
        }
        return end(session, TerminationReason.REVOKED, reason);
    }

    /**
     * Forcibly ends every active session of a principal, of a tenant, or of a principal within a
     * tenant.
     *
     * @return number of sessions revoked
     */
    public int revokeAll(String principalId, String tenantId, String reason) {
        if (principalId == null && tenantId == null) {
            throw new IllegalArgumentException("principalId or tenantId is required");
        }
        List<Session> targets = new ArrayList<>();
        Set<String> ids = principalId != null
                ? byPrincipal.getOrDefault(principalId, Set.of())
                : byTenant.getOrDefault(tenantId, Set.of());
        for (String id : ids) {
            Session session = sessions.get(id);
            if (session != null && session.isActive()
                    && (tenantId == null || tenantId.equals(session.tenantId()))) {
                targets.add(session);
            }
        }
        int revoked = 0;
        for (Session session : targets) {
            if (end(session, TerminationReason.REVOKED, reason)) {
                revoked++;
            }
        }
        log.warn("Revoked {} sessions (principal={}, tenant={}): {}", revoked, principalId, tenantId, reason);
        return revoked;
    }

    @Override
    public void statusChanged(Tenant tenant, TenantStatus previous) {
        if (!tenant.isActive()) {
            revokeAll(null, tenant.id(),
                    tenant.status() == TenantStatus.CANCELLED ? "tenant_cancelled" : "tenant_suspended");
        }
    }

    @Override
    public void bindingChanged(String principalId, String tenantId) {
        revokeAll(principalId, tenantId, "role_changed");
    }

    /** Active, unexpired sessions of a principal, oldest first. */
    public List<Session> activeSessions(String principalId) {
        Instant now = clock.instant();
        List<Session> active = new ArrayList<>();
        for (String id : byPrincipal.getOrDefault(principalId, Set.of())) {
            Session session = sessions.get(id);
            if (session != null && session.isActive() && session.timeoutAt(now).isEmpty()) {
                active.add(session);
            }
        }
        active.sort(Comparator.comparing(Session::createdAt));
        return active;
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Terminates sessions past their timeout and forgets terminated sessions whose absolute
     * lifetime has passed.
     *
     * @return number of sessions terminated by this sweep
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int ended = 0;
        for (Session session : new ArrayList<>(sessions.values())) {
            if (session.isActive()) {
                Optional<TerminationReason> timeout = session.timeoutAt(now);
                if (timeout.isPresent() && end(session, timeout.get(), timeout.get().value())) {
                    ended++;
                }
            } else if (!now.isBefore(session.expiresAt())) {
                forget(session);
            }
        }
        if (ended > 0) {
            log.info("Session sweep terminated {} sessions", ended);
        }
        return ended;
    }

    private boolean end(Session session, TerminationReason reason, String detail) {
        if (!session.terminate(reason)) {
            return false;
        }
        Instant now = clock.instant();
        metrics.recordSessionTermination(reason.value());
        if (reason == TerminationReason.REVOKED) {
            try {
                auditRecorder.recordDurably(AuditEvents.sessionLifecycle(AuditEventType.SESSION_REVOKED,
                        session.tenantId(), session.principalId(), session.sessionId(), detail, now),
                        revocationAuditTimeout);
            } catch (AuditWriteFailedException e) {
                // entry stays in the local buffer and is replayed
                log.error("Revocation audit for session {} not acknowledged by store, proceeding",
                        session.sessionId(), e);
            }
        } else {
            auditRecorder.record(AuditEvents.sessionLifecycle(AuditEventType.SESSION_TERMINATED,
                    session.tenantId(), session.principalId(), session.sessionId(), detail, now));
        }
        log.info("Session {} terminated: {}", session.sessionId(), reason.value());
        return true;
    }

    private void supersedeOldest(String principalId) {
        List<Session> active = activeSessions(principalId);
        int excess = active.size() - policy.maxConcurrentSessions() + 1;
        for (int i = 0; i < excess; i++) {
            end(active.get(i), TerminationReason.SUPERSEDED, "session_limit");
        }
    }

    private Optional<IndustryPolicy> industryPolicyFor(String tenantId) {
        Optional<Tenant> tenant = tenants.find(tenantId);
        Optional<PolicySnapshot> snapshot = policyStore.find();
        if (tenant.isEmpty() || snapshot.isEmpty()) {
            return Optional.empty();
        }
        return snapshot.get().policyFor(tenant.get().industry());
    }

    private void forget(Session session) {
        sessions.remove(session.sessionId());
        Set<String> ofPrincipal = byPrincipal.get(session.principalId());
        if (ofPrincipal != null) {
            ofPrincipal.remove(session.sessionId());
        }
        Set<String> ofTenant = byTenant.get(session.tenantId());
        if (ofTenant != null) {
            ofTenant.remove(session.sessionId());
        }
    }
}
