package com.thorbis.accessservice.infrastructure.web;

import com.thorbis.audit.AuditStoreUnavailableException;
import com.thorbis.audit.AuditWriteFailedException;
import com.thorbis.observability.RequestContextHolder;
import com.thorbis.security.access.AccessDeniedException;
import com.thorbis.security.access.Decision;
import com.thorbis.security.isolation.TenantMismatchException;
import com.thorbis.security.principal.UnauthenticatedException;
import com.thorbis.security.session.SessionException;
import com.thorbis.security.session.SessionRevokedException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Authorization failures of every kind share one body whose detail is {@code not_authorized};
 * whether the target tenant exists is never disclosed.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TYPE_BASE = "https://errors.thorbis.com/access/";

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        log.debug("Unauthenticated request: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthenticated", "unauthenticated",
                "unauthenticated");
    }

    @ExceptionHandler(SessionException.class)
    public ProblemDetail handleSession(SessionException ex) {
        String reason = ex instanceof SessionRevokedException ? "session_revoked" : "session_expired";
        log.debug("Session {} unusable: {}", ex.sessionId(), reason);
        return problem(HttpStatus.UNAUTHORIZED, "Session Ended", reason, reason);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.debug("Access denied: {}", ex.decision().reason());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", ex.publicReason(), "forbidden");
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Cross-tenant request refused: expected={} actual={}", ex.expectedTenantId(),
                ex.actualTenantId());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", Decision.NOT_AUTHORIZED, "forbidden");
    }

    @ExceptionHandler({AuditWriteFailedException.class, AuditStoreUnavailableException.class})
    public ProblemDetail handleAuditUnavailable(RuntimeException ex) {
        log.error("Audit durability failure: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Audit Unavailable",
                "the decision could not be recorded, retry later", "audit-unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "malformed request body",
                "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", detail, "validation");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            log.debug("Request rejected by the web layer: {}", ex.getMessage());
            ProblemDetail body = errorResponse.getBody();
            body.setProperty("timestamp", Instant.now().toString());
            return body;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", "internal");
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = RequestContextHolder.currentCorrelationId();
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return problem;
    }
}
