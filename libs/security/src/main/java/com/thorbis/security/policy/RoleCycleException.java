package com.thorbis.security.policy;

import java.util.List;

/**
 * Thrown when a role inheritance graph contains a cycle. {@link #cycle()} lists the roles along
 * the cycle with the first role repeated at the end, e.g. {@code [A, B, A]}.
 */
public class RoleCycleException extends PolicyValidationException {

    private final List<String> cycle;

    public RoleCycleException(List<String> cycle, List<String> diagnostics) {
        super(diagnostics);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }

    static String describe(List<String> cycle) {
        return "role inheritance cycle: " + String.join(" -> ", cycle);
    }
}
