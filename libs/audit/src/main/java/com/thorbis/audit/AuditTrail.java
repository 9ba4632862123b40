package com.thorbis.audit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of the audit log: filtered queries and chain verification over persisted entries.
 * Entries still in the durable buffer are not visible until replayed.
 */
public class AuditTrail {

    private final AuditStore store;

    public AuditTrail(AuditStore store) {
        this.store = store;
    }

    /** Entries matching {@code query}, newest first. */
    public List<AuditEntry> query(AuditQuery query) {
        return store.entries(query.tenantId()).stream()
                .filter(query::matches)
                .sorted(Comparator.comparingLong(AuditEntry::sequence).reversed())
                .limit(query.limit())
                .collect(Collectors.toList());
    }

    /**
     * Walks a partition in sequence order and reports missing numbers and hashes that do not
     * match.
     */
    public ChainVerification verify(String tenantId) {
        List<AuditEntry> entries = new ArrayList<>(store.entries(tenantId));
        entries.sort(Comparator.comparingLong(AuditEntry::sequence));

        List<SequenceGap> gaps = new ArrayList<>();
        List<Long> broken = new ArrayList<>();
        long expected = 1;
        AuditEntry previous = null;

        for (AuditEntry entry : entries) {
            if (entry.sequence() > expected) {
                gaps.add(new SequenceGap(expected, entry.sequence() - 1));
            }
            boolean linked = previous == null || previous.sequence() != entry.sequence() - 1
                    || previous.entryHash().equals(entry.previousHash());
            if (entry.sequence() == 1 && !AuditHasher.GENESIS_HASH.equals(entry.previousHash())) {
                linked = false;
            }
            if (!linked || !AuditHasher.matchesContent(entry)) {
                broken.add(entry.sequence());
            }
            expected = entry.sequence() + 1;
            previous = entry;
        }
        return new ChainVerification(tenantId, entries.size(), gaps, broken);
    }
}
