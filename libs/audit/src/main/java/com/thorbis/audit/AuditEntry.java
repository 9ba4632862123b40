package com.thorbis.audit;

import java.time.Instant;

/**
 * An immutable, sequenced record in a tenant's audit partition.
 *
 * <p>Entries are keyed by {@code (tenantId, sequence)}. Sequence numbers start at 1 and are
 * strictly monotonic per tenant, so a missing number is a detectable gap. {@code entryHash}
 * chains each entry to its predecessor; see {@link AuditHasher}.
 *
 * @param tenantId     audit partition
 * @param sequence     per-tenant sequence number
 * @param recordedAt   when the recorder sequenced the entry
 * @param previousHash hash of the entry with {@code sequence - 1} (genesis hash for the first)
 * @param entryHash    hash over this entry's content and {@code previousHash}
 * @param event        the recorded fact
 */
public record AuditEntry(
        String tenantId,
        long sequence,
        Instant recordedAt,
        String previousHash,
        String entryHash,
        AuditEvent event
) {}
