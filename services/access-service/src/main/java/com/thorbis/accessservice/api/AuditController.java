package com.thorbis.accessservice.api;

import com.thorbis.accessservice.infrastructure.web.CallerResolver;
import com.thorbis.audit.AuditEntry;
import com.thorbis.audit.AuditEventType;
import com.thorbis.audit.AuditEvents;
import com.thorbis.audit.AuditQuery;
import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.AuditResource;
import com.thorbis.audit.AuditSeverity;
import com.thorbis.audit.AuditTrail;
import com.thorbis.security.SensitivityLevel;
import com.thorbis.security.access.AccessDeniedException;
import com.thorbis.security.access.AuthorizationRequest;
import com.thorbis.security.access.AuthorizationResult;
import com.thorbis.security.access.AuthorizationService;
import com.thorbis.security.access.ResourceRef;
import com.thorbis.security.isolation.TenantMismatchException;
import com.thorbis.security.principal.ResolvedPrincipal;
import com.thorbis.security.session.Session;
import com.thorbis.security.session.SessionManager;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code record_event} for domain modules, and the audit trail for owner and administrator
 * tooling.
 *
 * <p>Reading a tenant's trail is itself an authorization decision on
 * {@code audit_log:read_audit_trail} and is audited like any other.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    static final String AUDIT_LOG = "audit_log";
    static final String READ_AUDIT_TRAIL = "read_audit_trail";

    private final CallerResolver callers;
    private final SessionManager sessions;
    private final AuditRecorder auditRecorder;
    private final AuditTrail auditTrail;
    private final AuthorizationService authorization;
    private final Clock clock;

    public AuditController(CallerResolver callers, SessionManager sessions, AuditRecorder auditRecorder,
            AuditTrail auditTrail, AuthorizationService authorization, Clock clock) {
        this.callers = callers;
        this.sessions = sessions;
        this.auditRecorder = auditRecorder;
        this.auditTrail = auditTrail;
        this.authorization = authorization;
        this.clock = clock;
    }

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RecordEventResponse recordEvent(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @Valid @RequestBody RecordEventRequest body) {
        ResolvedPrincipal caller = callers.resolve(authorizationHeader);
        Session session = sessions.validate(caller.sessionId());
        if (!session.tenantId().equals(body.tenantId()) && !caller.principal().isBoundTo(body.tenantId())) {
            throw new TenantMismatchException(session.tenantId(), body.tenantId());
        }

        AuditResource resource = body.resourceType() == null
                ? null
                : new AuditResource(body.resourceType(), body.resourceId());
        AuditEntry entry = auditRecorder.record(AuditEvents.domainFact(body.tenantId(),
                caller.principal().principalId(), caller.sessionId(), resource, body.action(),
                severityOf(body.severity()),
                AuthorizationController.withCorrelation(body.metadata()), clock.instant()));
        return new RecordEventResponse(entry.tenantId(), entry.sequence());
    }

    @GetMapping("/{tenantId}/entries")
    public List<AuditEntry> entries(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @PathVariable String tenantId,
            @RequestParam(required = false) String eventType,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "100") int limit) {
        requireAuditReader(authorizationHeader, tenantId);
        AuditEventType type = eventType == null
                ? null
                : AuditEventType.fromString(eventType).orElseThrow(
                        () -> new IllegalArgumentException("Unknown event type '" + eventType + "'"));
        AuditSeverity minimum = severity == null ? null : severityOf(severity);
        return auditTrail.query(new AuditQuery(tenantId, type, minimum, from, to, limit));
    }

    @GetMapping("/{tenantId}/verification")
    public ChainVerificationResponse verification(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
            @PathVariable String tenantId) {
        requireAuditReader(authorizationHeader, tenantId);
        return ChainVerificationResponse.from(auditTrail.verify(tenantId));
    }

    private void requireAuditReader(String authorizationHeader, String tenantId) {
        ResolvedPrincipal caller = callers.resolve(authorizationHeader);
        AuthorizationResult result = authorization.authorize(new AuthorizationRequest(
                caller.principal().principalId(),
                caller.sessionId(),
                tenantId,
                new ResourceRef(tenantId, AUDIT_LOG, null, SensitivityLevel.CONFIDENTIAL, null, null),
                READ_AUDIT_TRAIL,
                null,
                AuthorizationController.withCorrelation(Map.of())));
        if (!result.isAllowed()) {
            throw new AccessDeniedException(result.decision());
        }
    }

    static AuditSeverity severityOf(String name) {
        if (name == null || name.isBlank()) {
            return AuditSeverity.LOW;
        }
        try {
            return AuditSeverity.valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity '" + name + "'", e);
        }
    }
}
