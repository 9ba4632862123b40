package com.thorbis.accessservice.api;

import com.thorbis.audit.ChainVerification;
import com.thorbis.audit.SequenceGap;
import java.util.List;

/**
 * Result of walking a tenant's hash chain.
 *
 * @param tenantId       partition checked
 * @param intact         no gaps and no broken links
 * @param entriesChecked entries walked
 * @param gaps           missing sequence ranges
 * @param brokenLinks    sequence numbers whose hash does not match
 */
public record ChainVerificationResponse(
        String tenantId, boolean intact, long entriesChecked, List<SequenceGap> gaps, List<Long> brokenLinks) {

    static ChainVerificationResponse from(ChainVerification verification) {
        return new ChainVerificationResponse(verification.tenantId(), verification.intact(),
                verification.entriesChecked(), verification.gaps(), verification.brokenLinks());
    }
}
