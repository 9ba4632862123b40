package com.thorbis.security.policy;

import java.util.List;

/**
 * Outcome of {@link PolicyStore#reload}.
 *
 * @param success       true if the requested version is now active
 * @param version       the version that was requested
 * @param activeVersion the version active after the attempt
 * @param diagnostics   validation problems when the reload was rejected
 */
public record PolicyReloadResult(boolean success, String version, String activeVersion, List<String> diagnostics) {

    public PolicyReloadResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    static PolicyReloadResult accepted(String version) {
        return new PolicyReloadResult(true, version, version, List.of());
    }

    static PolicyReloadResult rejected(String version, String activeVersion, List<String> diagnostics) {
        return new PolicyReloadResult(false, version, activeVersion, diagnostics);
    }
}
