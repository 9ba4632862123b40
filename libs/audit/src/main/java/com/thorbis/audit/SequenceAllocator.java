package com.thorbis.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Hands out per-tenant sequence numbers and chains hashes.
 * <p>
 * Allocation for one tenant is serialized on that tenant's partition; different tenants never
 * contend. The first time a tenant is seen its tail is looked up so that numbering continues
 * after a restart.
 */
public class SequenceAllocator {

    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();
    private final Function<String, Optional<AuditEntry>> tailLookup;

    /**
     * @param tailLookup returns the highest-sequenced entry already persisted or buffered for a
     *                   tenant
     */
    public SequenceAllocator(Function<String, Optional<AuditEntry>> tailLookup) {
        this.tailLookup = tailLookup;
    }

    /** Sequences {@code event} into its tenant's partition. */
    public AuditEntry next(AuditEvent event, Instant recordedAt) {
        return next(event, recordedAt, Function.identity());
    }

    /**
     * Sequences {@code event} and hands the entry to {@code delivery} while the partition is still
     * held, so entries of one tenant reach {@code delivery} in sequence order. If {@code delivery}
     * throws, the sequence number is not consumed.
     */
    public <T> T next(AuditEvent event, Instant recordedAt, Function<AuditEntry, T> delivery) {
        String tenantId = event.tenantId();
        Partition partition = partitions.computeIfAbsent(tenantId, this::loadPartition);
        synchronized (partition) {
            long sequence = partition.lastSequence + 1;
            String entryHash = AuditHasher.hash(partition.lastHash, tenantId, sequence, recordedAt, event);
            AuditEntry entry = new AuditEntry(tenantId, sequence, recordedAt, partition.lastHash,
                    entryHash, event);
            T result = delivery.apply(entry);
            partition.lastSequence = sequence;
            partition.lastHash = entryHash;
            return result;
        }
    }

    /** Last sequence handed out for a tenant, 0 if none. */
    public long lastSequence(String tenantId) {
        Partition partition = partitions.get(tenantId);
        if (partition == null) {
            return tailLookup.apply(tenantId).map(AuditEntry::sequence).orElse(0L);
        }
        synchronized (partition) {
            return partition.lastSequence;
        }
    }

    private Partition loadPartition(String tenantId) {
        Partition partition = new Partition();
        tailLookup.apply(tenantId).ifPresent(tail -> {
            partition.lastSequence = tail.sequence();
            partition.lastHash = tail.entryHash();
        });
        return partition;
    }

    private static final class Partition {
        private long lastSequence;
        private String lastHash = AuditHasher.GENESIS_HASH;
    }
}
