package com.thorbis.accessservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.thorbis.observability.RequestContext;
import com.thorbis.observability.RequestContextHolder;
import com.thorbis.security.access.AccessDeniedException;
import com.thorbis.security.access.Decision;
import com.thorbis.security.access.ReasonCode;
import com.thorbis.security.isolation.TenantMismatchException;
import com.thorbis.security.principal.UnauthenticatedException;
import com.thorbis.security.session.SessionExpiredException;
import com.thorbis.security.session.SessionRevokedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import org.springframework.http.HttpMethod;

/**
 * Tests for GlobalExceptionHandler.
 *
 * <p>WHY: Verify that each domain exception maps to its problem detail and status.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Test
    @DisplayName("maps a missing or bad token to 401")
    void unauthenticated() {
        ProblemDetail result = handler.handleUnauthenticated(new UnauthenticatedException("token failed verification"));

        assertThat(result.getStatus()).isEqualTo(401);
        assertThat(result.getDetail()).isEqualTo("unauthenticated");
    }

    @Test
    @DisplayName("distinguishes revoked from expired sessions")
    void sessionEnded() {
        assertThat(handler.handleSession(new SessionRevokedException("s-1")).getDetail())
                .isEqualTo("session_revoked");
        assertThat(handler.handleSession(new SessionExpiredException("s-2", "idle_timeout")).getDetail())
                .isEqualTo("session_expired");
    }

    @Test
    @DisplayName("never names either tenant on a mismatch")
    void tenantMismatchIsOpaque() {
        ProblemDetail result = handler.handleTenantMismatch(new TenantMismatchException("biz-1", "biz-2"));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).isEqualTo("not_authorized");
        assertThat(result.toString()).doesNotContain("biz-1").doesNotContain("biz-2");
    }

    @Test
    @DisplayName("denials expose only the public reason")
    void accessDenied() {
        ProblemDetail result = handler.handleAccessDenied(
                new AccessDeniedException(Decision.deny(ReasonCode.NO_TENANT_BINDING, "2026.03")));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).isEqualTo("not_authorized");
    }

    @Test
    @DisplayName("keeps the status of web-layer errors")
    void webLayerError() {
        ProblemDetail result = handler.handleGeneric(new NoResourceFoundException(HttpMethod.GET, "nope"));

        assertThat(result.getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("hides the cause of unexpected errors and adds the correlation id")
    void unexpected() {
        RequestContextHolder.set(RequestContext.of("corr-9"));

        ProblemDetail result = handler.handleGeneric(new IllegalStateException("db password is hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("hunter2");
        assertThat(result.getProperties()).containsEntry("correlationId", "corr-9").containsKey("timestamp");
    }
}
