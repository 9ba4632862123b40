package com.thorbis.security.isolation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Marks soft-deleted rows older than a retention period as purge-eligible. Physical removal is
 * left to the external retention job.
 */
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final TenantDataStore store;
    private final Clock clock;

    public RetentionSweeper(TenantDataStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public int sweep(String tenantId, Duration retention) {
        int moved = store.markPurgeEligible(new TenantPredicate(tenantId), clock.instant().minus(retention));
        if (moved > 0) {
            log.info("Marked {} rows of tenant {} purge-eligible", moved, tenantId);
        }
        return moved;
    }
}
