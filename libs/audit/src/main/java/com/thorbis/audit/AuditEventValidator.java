package com.thorbis.audit;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that an {@link AuditEvent} carries everything a Decision Record needs. All problems are
 * reported at once.
 */
public final class AuditEventValidator {

    private static final Set<AuditEventType> RESOURCE_EVENTS = EnumSet.of(
            AuditEventType.ACCESS_DECISION,
            AuditEventType.DATA_WRITE,
            AuditEventType.DATA_DELETE,
            AuditEventType.CROSS_TENANT_READ,
            AuditEventType.DOMAIN_EVENT);

    private AuditEventValidator() {
        // utility class
    }

    public static ValidationResult validate(AuditEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (event.eventType() == null) {
            errors.add("eventType must not be null");
        }
        if (event.severity() == null) {
            errors.add("severity must not be null");
        }
        if (isBlank(event.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (event.outcome() == null) {
            errors.add("outcome must not be null");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (event.eventType() != null && RESOURCE_EVENTS.contains(event.eventType())) {
            if (isBlank(event.action())) {
                errors.add("action must not be null or blank for " + event.eventType().value());
            }
            if (event.resource() == null) {
                errors.add("resource must not be null for " + event.eventType().value());
            } else if (isBlank(event.resource().resourceType())) {
                errors.add("resource.resourceType must not be null or blank");
            }
        }
        if (event.eventType() == AuditEventType.ACCESS_DECISION && isBlank(event.reasonCode())) {
            errors.add("reasonCode must not be null or blank for access_decision");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
