package com.thorbis.security.isolation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TenantDataStore} held in memory. Rows are keyed by (tenant, resource type, resource id),
 * matching the persisted layout, so one tenant's ids say nothing about another's.
 */
public class InMemoryTenantDataStore implements TenantDataStore {

    private record Key(String tenantId, String resourceType, String resourceId) {}

    private final Map<Key, Row> rows = new ConcurrentHashMap<>();

    @Override
    public List<Row> select(TenantPredicate predicate, ReadQuery query) {
        List<Row> result = new ArrayList<>();
        for (Row row : rows.values()) {
            if (!predicate.matches(row) || !query.matches(row)) {
                continue;
            }
            if (row.state() != RowState.ACTIVE && !query.includeDeleted()) {
                continue;
            }
            result.add(row);
            if (query.limit() > 0 && result.size() >= query.limit()) {
                break;
            }
        }
        return result;
    }

    @Override
    public Optional<Row> find(TenantPredicate predicate, String resourceType, String resourceId) {
        return Optional.ofNullable(rows.get(new Key(predicate.tenantId(), resourceType, resourceId)))
                .filter(predicate::matches);
    }

    @Override
    public Row upsert(TenantPredicate predicate, Row row) {
        if (!predicate.matches(row)) {
            throw new TenantMismatchException(predicate.tenantId(), row.tenantId());
        }
        return rows.compute(new Key(row.tenantId(), row.resourceType(), row.resourceId()), (key, existing) -> {
            if (existing != null && !existing.isActive()) {
                throw new DeletedRowException(row.resourceType(), row.resourceId(), existing.state());
            }
            return row;
        });
    }

    @Override
    public boolean markDeleted(TenantPredicate predicate, String resourceType, String resourceId, Instant at) {
        boolean[] changed = new boolean[1];
        rows.computeIfPresent(new Key(predicate.tenantId(), resourceType, resourceId), (key, existing) -> {
            if (!predicate.matches(existing) || existing.state() != RowState.ACTIVE) {
                return existing;
            }
            changed[0] = true;
            return new Row(existing.tenantId(), existing.resourceType(), existing.resourceId(),
                    existing.attributes(), RowState.SOFT_DELETED, existing.createdAt(), at);
        });
        return changed[0];
    }

    @Override
    public int markPurgeEligible(TenantPredicate predicate, Instant cutoff) {
        int moved = 0;
        for (Map.Entry<Key, Row> entry : rows.entrySet()) {
            Row row = entry.getValue();
            if (predicate.matches(row) && row.state() == RowState.SOFT_DELETED
                    && row.deletedAt() != null && row.deletedAt().isBefore(cutoff)) {
                Row eligible = new Row(row.tenantId(), row.resourceType(), row.resourceId(), row.attributes(),
                        RowState.PURGE_ELIGIBLE, row.createdAt(), row.deletedAt());
                if (rows.replace(entry.getKey(), row, eligible)) {
                    moved++;
                }
            }
        }
        return moved;
    }
}
