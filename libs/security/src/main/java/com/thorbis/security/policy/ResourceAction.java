package com.thorbis.security.policy;

/**
 * A (resource type, action) pair a policy declares, e.g. ("estimate", "approve_estimate").
 */
public record ResourceAction(String resourceType, String action) {

    @Override
    public String toString() {
        return resourceType + ":" + action;
    }
}
