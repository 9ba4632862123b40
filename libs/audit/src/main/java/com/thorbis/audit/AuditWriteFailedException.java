package com.thorbis.audit;

import java.time.Duration;

/**
 * Thrown by {@link AuditRecorder#recordDurably} when an entry could not be persisted within the
 * allowed time, or the store refused to replay the buffer. The entry stays in the durable buffer.
 */
public class AuditWriteFailedException extends RuntimeException {

    private final String tenantId;
    private final long sequence;

    public AuditWriteFailedException(AuditEntry entry, Duration timeout) {
        super("Audit entry " + entry.tenantId() + "#" + entry.sequence()
                + " not persisted within " + timeout.toMillis() + "ms");
        this.tenantId = entry.tenantId();
        this.sequence = entry.sequence();
    }

    public AuditWriteFailedException(AuditEntry entry, Throwable cause) {
        super("Audit entry " + entry.tenantId() + "#" + entry.sequence() + " not persisted: "
                + cause.getMessage(), cause);
        this.tenantId = entry.tenantId();
        this.sequence = entry.sequence();
    }

    public String tenantId() {
        return tenantId;
    }

    public long sequence() {
        return sequence;
    }
}
