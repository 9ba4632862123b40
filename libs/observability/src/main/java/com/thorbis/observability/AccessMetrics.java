package com.thorbis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer instruments for the access-control engine.
 * <p>
 * Every meter carries a {@code service} tag. Decision counters are additionally tagged with the
 * outcome and reason code so that deny spikes can be broken down without touching the audit log.
 * Tenant IDs are deliberately not used as tags: tenant cardinality is unbounded.
 */
public final class AccessMetrics {

    /** Tag key for the owning service. */
    public static final String TAG_SERVICE = "service";

    public static final String DECISIONS = "access.decisions";
    public static final String EVALUATION = "access.evaluation";
    public static final String AUDIT_BUFFER_DEPTH = "audit.buffer.depth";
    public static final String AUDIT_WRITE_FAILURES = "audit.write.failures";
    public static final String SESSION_TERMINATIONS = "session.terminations";
    public static final String POLICY_RELOADS = "policy.reloads";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Timer evaluationTimer;
    private final Counter auditWriteFailures;
    private final AtomicLong auditBufferDepth = new AtomicLong();

    /**
     * @param registry    the meter registry (Prometheus in the service, simple registry in tests)
     * @param serviceName logical service name applied as the {@code service} tag
     */
    public AccessMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.evaluationTimer = Timer.builder(EVALUATION)
                .description("Time spent evaluating a single authorization request")
                .tags(serviceTags())
                .register(registry);
        this.auditWriteFailures = Counter.builder(AUDIT_WRITE_FAILURES)
                .description("Audit appends rejected by the underlying store")
                .tags(serviceTags())
                .register(registry);
        Gauge.builder(AUDIT_BUFFER_DEPTH, auditBufferDepth, AtomicLong::doubleValue)
                .description("Audit entries waiting in the durable local buffer")
                .tags(serviceTags())
                .register(registry);
    }

    /** Counts one authorization decision. */
    public void recordDecision(String outcome, String reason) {
        Counter.builder(DECISIONS)
                .description("Authorization decisions by outcome and reason")
                .tags(serviceTags().and("outcome", outcome, "reason", reason))
                .register(registry)
                .increment();
    }

    /** Records how long one evaluation took. */
    public void recordEvaluation(Duration elapsed) {
        evaluationTimer.record(elapsed);
    }

    /** Counts one failed append against the audit store. */
    public void recordAuditWriteFailure() {
        auditWriteFailures.increment();
    }

    /** Publishes the current number of buffered audit entries. */
    public void updateAuditBufferDepth(long depth) {
        auditBufferDepth.set(depth);
    }

    /** Counts a session leaving the active state. */
    public void recordSessionTermination(String reason) {
        Counter.builder(SESSION_TERMINATIONS)
                .description("Sessions terminated by reason")
                .tags(serviceTags().and("reason", reason))
                .register(registry)
                .increment();
    }

    /** Counts a policy reload attempt by result ({@code success} or {@code rejected}). */
    public void recordPolicyReload(String result) {
        Counter.builder(POLICY_RELOADS)
                .description("Policy reload attempts by result")
                .tags(serviceTags().and("result", result))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags serviceTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
