package com.thorbis.security.isolation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage behind the {@link TenantIsolationGate}. Every operation takes a {@link TenantPredicate};
 * implementations must apply it to the underlying query.
 */
public interface TenantDataStore {

    /** Rows of the predicate's tenant matching the query. Soft-deleted rows only when requested. */
    List<Row> select(TenantPredicate predicate, ReadQuery query);

    /** One row of the predicate's tenant, in any state. */
    Optional<Row> find(TenantPredicate predicate, String resourceType, String resourceId);

    /**
     * Inserts or replaces a row. Ids are scoped per tenant.
     *
     * @throws TenantMismatchException if the row is outside the predicate
     * @throws DeletedRowException     if the existing row is no longer active
     */
    Row upsert(TenantPredicate predicate, Row row);

    /** Soft-deletes a row. Returns false if there was no active row. */
    boolean markDeleted(TenantPredicate predicate, String resourceType, String resourceId, Instant at);

    /** Moves rows soft-deleted before {@code cutoff} to purge-eligible. Returns how many moved. */
    int markPurgeEligible(TenantPredicate predicate, Instant cutoff);
}
