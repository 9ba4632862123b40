package com.thorbis.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper over an OpenTelemetry {@link Tracer} for engine operations.
 * <p>
 * Spans are tagged with the tenant, principal and session of the current {@link RequestContext}.
 * The helper does not configure the SDK; the service wires a tracer at boot, and
 * {@link #noop()} is used where tracing is not configured.
 */
public final class AccessTracer {

    private final Tracer tracer;

    public AccessTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** A tracer whose spans are discarded. */
    public static AccessTracer noop() {
        return new AccessTracer(io.opentelemetry.api.OpenTelemetry.noop().getTracer("thorbis-noop"));
    }

    /**
     * Runs the operation inside an internal span named {@code operation}.
     *
     * @param operation  span name, e.g. {@code access.authorize}
     * @param attributes extra span attributes
     * @param work       the traced work; runtime exceptions are recorded on the span and rethrown
     */
    public <T> T trace(String operation, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(operation).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        RequestContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.principalId() != null) {
                span.setAttribute("principal.id", ctx.principalId());
            }
            if (ctx.sessionId() != null) {
                span.setAttribute("session.id", ctx.sessionId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
