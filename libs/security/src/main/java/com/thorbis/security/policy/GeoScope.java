package com.thorbis.security.policy;

import com.thorbis.security.ConstraintCategory;

import java.util.List;
import java.util.Locale;

/**
 * Caller must be in one of the listed regions. A request without a region fails.
 *
 * @param regions allowed region codes, compared case-insensitively
 */
public record GeoScope(List<String> regions) implements GrantConstraint {

    public GeoScope {
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    @Override
    public ConstraintCategory category() {
        return ConstraintCategory.GEO_RESTRICTED;
    }

    @Override
    public boolean test(ConstraintInput input) {
        if (input.region() == null) {
            return false;
        }
        String region = input.region().toUpperCase(Locale.ROOT);
        return regions.stream().anyMatch(r -> r.toUpperCase(Locale.ROOT).equals(region));
    }

    @Override
    public List<String> validate() {
        return regions.isEmpty() ? List.of("geo_scope requires at least one region") : List.of();
    }
}
