package com.thorbis.accessservice.config;

import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.AuditStore;
import com.thorbis.audit.AuditTrail;
import com.thorbis.audit.DurableAuditBuffer;
import com.thorbis.audit.InMemoryAuditStore;
import com.thorbis.audit.RetryBackoff;
import com.thorbis.observability.AccessMetrics;
import com.thorbis.observability.AccessTracer;
import com.thorbis.observability.MetadataRedactor;
import com.thorbis.security.SensitivityLevel;
import com.thorbis.security.access.AccessEvaluator;
import com.thorbis.security.access.AuditDurabilityPolicy;
import com.thorbis.security.access.AuthorizationService;
import com.thorbis.security.policy.ClasspathPolicyDocumentSource;
import com.thorbis.security.policy.PolicyDocumentSource;
import com.thorbis.security.policy.PolicyStore;
import com.thorbis.security.principal.HmacTokenVerifier;
import com.thorbis.security.principal.InMemoryPrincipalDirectory;
import com.thorbis.security.principal.PrincipalResolver;
import com.thorbis.security.session.SessionManager;
import com.thorbis.security.session.SessionPolicy;
import com.thorbis.security.tenant.TenantRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the access engine from {@link AccessProperties}.
 *
 * <p>The libraries are plain Java; this is the only place they meet Spring. Audit entries go to
 * an in-process store unless another {@link AuditStore} bean is defined.
 */
@Configuration
public class AccessEngineConfig {

    static final String INSTRUMENTATION_SCOPE = "com.thorbis.access";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AccessMetrics accessMetrics(MeterRegistry registry, AccessProperties properties) {
        return new AccessMetrics(registry, properties.serviceName());
    }

    @Bean
    public AccessTracer accessTracer() {
        return new AccessTracer(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditStore auditStore() {
        return new InMemoryAuditStore();
    }

    @Bean(destroyMethod = "close")
    public AuditRecorder auditRecorder(AuditStore store, AccessProperties properties, Clock clock,
            AccessMetrics metrics) {
        AccessProperties.Audit audit = properties.audit();
        RetryBackoff backoff = new RetryBackoff(audit.retryInitial(), 2.0, audit.retryMax());
        return new AuditRecorder(store, new DurableAuditBuffer(audit.bufferDir()), backoff, clock,
                metrics, new MetadataRedactor());
    }

    @Bean
    public AuditTrail auditTrail(AuditStore store) {
        return new AuditTrail(store);
    }

    @Bean
    public TenantRegistry tenantRegistry() {
        return new TenantRegistry();
    }

    @Bean
    public InMemoryPrincipalDirectory principalDirectory() {
        return new InMemoryPrincipalDirectory();
    }

    @Bean
    public HmacTokenVerifier tokenVerifier(AccessProperties properties, Clock clock) {
        return new HmacTokenVerifier(properties.tokenSecretBytes(), clock);
    }

    @Bean
    public PolicyDocumentSource policyDocumentSource(AccessProperties properties) {
        return new ClasspathPolicyDocumentSource(properties.policy().location());
    }

    @Bean
    public PolicyStore policyStore(PolicyDocumentSource source, AccessProperties properties, Clock clock,
            AccessMetrics metrics, AuditRecorder auditRecorder) {
        PolicyStore store =
                new PolicyStore(source, properties.policy().version(), clock, metrics, auditRecorder);
        store.loadPolicies();
        return store;
    }

    @Bean
    public SessionManager sessionManager(AccessProperties properties, PolicyStore policyStore,
            TenantRegistry tenants, InMemoryPrincipalDirectory directory, AuditRecorder auditRecorder,
            Clock clock, AccessMetrics metrics) {
        AccessProperties.Session session = properties.session();
        SessionPolicy policy = new SessionPolicy(session.defaultIdleTimeout(), session.maxLifetime(),
                session.maxConcurrent());
        SessionManager manager = new SessionManager(policy, policyStore, tenants, auditRecorder,
                session.revocationAuditTimeout(), clock, metrics);
        tenants.addListener(manager);
        directory.addListener(manager);
        return manager;
    }

    @Bean
    public PrincipalResolver principalResolver(HmacTokenVerifier tokens,
            InMemoryPrincipalDirectory directory, TenantRegistry tenants, SessionManager sessions) {
        return new PrincipalResolver(tokens, directory, tenants, sessions);
    }

    @Bean
    public AccessEvaluator accessEvaluator(PolicyStore policyStore, TenantRegistry tenants,
            AccessMetrics metrics) {
        return new AccessEvaluator(policyStore, tenants, metrics);
    }

    @Bean
    public AuditDurabilityPolicy auditDurabilityPolicy(AccessProperties properties) {
        AccessProperties.Audit audit = properties.audit();
        return new AuditDurabilityPolicy(SensitivityLevel.valueOf(audit.sensitivityThreshold()),
                audit.criticalActions(), audit.syncTimeout());
    }

    @Bean
    public AuthorizationService authorizationService(PrincipalResolver principals,
            SessionManager sessions, AccessEvaluator evaluator, TenantRegistry tenants,
            AuditRecorder auditRecorder, AuditDurabilityPolicy durability, AccessTracer tracer,
            Clock clock) {
        return new AuthorizationService(principals, sessions, evaluator, tenants, auditRecorder,
                durability, tracer, clock);
    }
}
