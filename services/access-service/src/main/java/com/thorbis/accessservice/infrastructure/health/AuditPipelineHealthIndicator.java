package com.thorbis.accessservice.infrastructure.health;

import com.thorbis.audit.AuditRecorder;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports the audit pipeline {@code DEGRADED} while entries are waiting in the local buffer for
 * the store to come back.
 */
@Component("auditPipeline")
public class AuditPipelineHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "audit entries are buffered locally");

    private final AuditRecorder auditRecorder;

    public AuditPipelineHealthIndicator(AuditRecorder auditRecorder) {
        this.auditRecorder = auditRecorder;
    }

    @Override
    public Health health() {
        int buffered = auditRecorder.bufferedCount();
        Health.Builder builder = buffered > 0 ? Health.status(DEGRADED) : Health.up();
        return builder.withDetail("bufferedEntries", buffered).build();
    }
}
