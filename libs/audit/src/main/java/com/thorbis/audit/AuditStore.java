package com.thorbis.audit;

import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence for audit entries.
 * <p>
 * Implementations must accept a re-append of an entry they already hold (same tenant, sequence
 * and hash) as a no-op, since the recorder may retry after a write whose acknowledgement was
 * lost. There is no update or delete.
 */
public interface AuditStore {

    /**
     * Persists one entry.
     *
     * @throws AuditStoreUnavailableException if the store cannot accept writes right now
     */
    void append(AuditEntry entry);

    /** Highest-sequenced entry for a tenant. */
    Optional<AuditEntry> lastEntry(String tenantId);

    /** All entries of a tenant in ascending sequence order. */
    List<AuditEntry> entries(String tenantId);
}
