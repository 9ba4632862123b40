package com.thorbis.security.testing;

import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.AuditTrail;
import com.thorbis.audit.DurableAuditBuffer;
import com.thorbis.audit.InMemoryAuditStore;
import com.thorbis.audit.RetryBackoff;
import com.thorbis.observability.AccessMetrics;
import com.thorbis.observability.AccessTracer;
import com.thorbis.observability.MetadataRedactor;
import com.thorbis.security.access.AccessEvaluator;
import com.thorbis.security.access.AuditDurabilityPolicy;
import com.thorbis.security.access.AuthorizationService;
import com.thorbis.security.isolation.InMemoryTenantDataStore;
import com.thorbis.security.isolation.TenantIsolationGate;
import com.thorbis.security.policy.PolicyDocumentSource;
import com.thorbis.security.policy.PolicyStore;
import com.thorbis.security.principal.HmacTokenVerifier;
import com.thorbis.security.principal.InMemoryPrincipalDirectory;
import com.thorbis.security.principal.PrincipalResolver;
import com.thorbis.security.session.SessionManager;
import com.thorbis.security.session.SessionPolicy;
import com.thorbis.security.tenant.TenantRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * The whole engine wired over in-memory stores and a {@link MutableClock}.
 * <p>
 * The audit recorder's background replay is parked; tests drain the buffer with
 * {@code auditRecorder().flush()}.
 */
public final class TestAccessEngine implements AutoCloseable {

    public static final Instant START = Instant.parse("2026-03-02T15:00:00Z");
    public static final byte[] TOKEN_SECRET =
            "test-token-secret-with-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);

    private final MutableClock clock = new MutableClock(START);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final AccessMetrics metrics = new AccessMetrics(meterRegistry, "access-test");
    private final InMemoryAuditStore auditStore = new InMemoryAuditStore();
    private final AuditRecorder auditRecorder;
    private final TenantRegistry tenants = new TenantRegistry();
    private final InMemoryPrincipalDirectory directory = new InMemoryPrincipalDirectory();
    private final HmacTokenVerifier tokens = new HmacTokenVerifier(TOKEN_SECRET, clock);
    private final PolicyStore policyStore;
    private final SessionManager sessions;
    private final PrincipalResolver principals;
    private final AccessEvaluator evaluator;
    private final AuthorizationService authorization;
    private final InMemoryTenantDataStore dataStore = new InMemoryTenantDataStore();
    private final TenantIsolationGate gate;

    /**
     * @param policies       document source
     * @param policyVersion  version loaded at start
     * @param auditBufferDir directory for the durable audit buffer
     */
    public TestAccessEngine(PolicyDocumentSource policies, String policyVersion, Path auditBufferDir) {
        this(policies, policyVersion, auditBufferDir, SessionPolicy.defaults(), AuditDurabilityPolicy.defaults());
    }

    public TestAccessEngine(PolicyDocumentSource policies, String policyVersion, Path auditBufferDir,
                            SessionPolicy sessionPolicy, AuditDurabilityPolicy durability) {
        RetryBackoff parked = new RetryBackoff(Duration.ofHours(1), 2.0, Duration.ofHours(1));
        this.auditRecorder = new AuditRecorder(auditStore, new DurableAuditBuffer(auditBufferDir), parked, clock,
                metrics, new MetadataRedactor());
        this.policyStore = new PolicyStore(policies, policyVersion, clock, metrics, auditRecorder);
        policyStore.loadPolicies();
        this.sessions = new SessionManager(sessionPolicy, policyStore, tenants, auditRecorder,
                Duration.ofMillis(200), clock, metrics);
        tenants.addListener(sessions);
        directory.addListener(sessions);
        this.principals = new PrincipalResolver(tokens, directory, tenants, sessions);
        this.evaluator = new AccessEvaluator(policyStore, tenants, metrics);
        this.authorization = new AuthorizationService(principals, sessions, evaluator, tenants, auditRecorder,
                durability, AccessTracer.noop(), clock);
        this.gate = new TenantIsolationGate(sessions, principals, evaluator, dataStore, auditRecorder, clock,
                AccessTracer.noop());
    }

    public MutableClock clock() {
        return clock;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public InMemoryAuditStore auditStore() {
        return auditStore;
    }

    public AuditRecorder auditRecorder() {
        return auditRecorder;
    }

    public AuditTrail auditTrail() {
        return new AuditTrail(auditStore);
    }

    public TenantRegistry tenants() {
        return tenants;
    }

    public InMemoryPrincipalDirectory directory() {
        return directory;
    }

    public HmacTokenVerifier tokens() {
        return tokens;
    }

    public PolicyStore policyStore() {
        return policyStore;
    }

    public SessionManager sessions() {
        return sessions;
    }

    public PrincipalResolver principals() {
        return principals;
    }

    public AccessEvaluator evaluator() {
        return evaluator;
    }

    public AuthorizationService authorization() {
        return authorization;
    }

    public InMemoryTenantDataStore dataStore() {
        return dataStore;
    }

    public TenantIsolationGate gate() {
        return gate;
    }

    @Override
    public void close() {
        auditRecorder.close();
    }
}
