package com.thorbis.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link AuditStore} held in memory. Used by tests and by the service when no database is
 * configured. {@link #setAvailable(boolean)} simulates an outage.
 */
public class InMemoryAuditStore implements AuditStore {

    private final Map<String, NavigableMap<Long, AuditEntry>> partitions = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public void append(AuditEntry entry) {
        if (!available) {
            throw new AuditStoreUnavailableException("audit store is unavailable");
        }
        NavigableMap<Long, AuditEntry> partition =
                partitions.computeIfAbsent(entry.tenantId(), t -> new ConcurrentSkipListMap<>());
        AuditEntry existing = partition.putIfAbsent(entry.sequence(), entry);
        if (existing != null && !existing.entryHash().equals(entry.entryHash())) {
            throw new IllegalStateException("Sequence " + entry.tenantId() + "#" + entry.sequence()
                    + " already holds a different entry");
        }
    }

    @Override
    public Optional<AuditEntry> lastEntry(String tenantId) {
        NavigableMap<Long, AuditEntry> partition = partitions.get(tenantId);
        if (partition == null || partition.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(partition.lastEntry().getValue());
    }

    @Override
    public List<AuditEntry> entries(String tenantId) {
        NavigableMap<Long, AuditEntry> partition = partitions.get(tenantId);
        return partition == null ? List.of() : new ArrayList<>(partition.values());
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * Replaces a stored entry in place, bypassing append-only checks. Tests use it to simulate
     * tampering with persisted records.
     */
    public void overwrite(AuditEntry entry) {
        partitions.computeIfAbsent(entry.tenantId(), t -> new ConcurrentSkipListMap<>())
                .put(entry.sequence(), entry);
    }

    /** Removes a stored entry. Tests use it to simulate a lost record. */
    public void remove(String tenantId, long sequence) {
        NavigableMap<Long, AuditEntry> partition = partitions.get(tenantId);
        if (partition != null) {
            partition.remove(sequence);
        }
    }
}
