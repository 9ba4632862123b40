package com.thorbis.security.policy;

import java.util.List;

/**
 * Thrown when policy documents fail load-time validation. Carries every problem found, not just
 * the first.
 */
public class PolicyValidationException extends RuntimeException {

    private final List<String> diagnostics;

    public PolicyValidationException(List<String> diagnostics) {
        super("Policy validation failed: " + String.join("; ", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<String> diagnostics() {
        return diagnostics;
    }
}
