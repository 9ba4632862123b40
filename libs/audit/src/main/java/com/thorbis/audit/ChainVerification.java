package com.thorbis.audit;

import java.util.List;

/**
 * Result of walking one tenant's audit partition.
 *
 * @param tenantId       partition that was checked
 * @param entriesChecked number of stored entries examined
 * @param gaps           missing sequence ranges
 * @param brokenLinks    sequences whose hash does not match their content or predecessor
 */
public record ChainVerification(
        String tenantId,
        long entriesChecked,
        List<SequenceGap> gaps,
        List<Long> brokenLinks
) {

    public ChainVerification {
        gaps = List.copyOf(gaps);
        brokenLinks = List.copyOf(brokenLinks);
    }

    public boolean intact() {
        return gaps.isEmpty() && brokenLinks.isEmpty();
    }
}
