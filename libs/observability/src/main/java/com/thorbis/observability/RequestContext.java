package com.thorbis.observability;

/**
 * Immutable per-request context that travels with every authorization, gate and audit call.
 * <p>
 * Each inbound request (HTTP call, background sweep, policy reload) establishes a
 * {@code RequestContext} so that log lines, spans and audit entries can all be tied back to the
 * same request. Values are mirrored into SLF4J MDC by {@link RequestContextHolder}.
 *
 * @param correlationId unique ID for the business flow, echoed back to callers
 * @param tenantId      tenant the request acts on (nullable until resolved)
 * @param principalId   authenticated principal (nullable for system work)
 * @param sessionId     session the request runs under (nullable for system work)
 * @param requestId     unique ID for this request within the correlation flow
 */
public record RequestContext(
        String correlationId,
        String tenantId,
        String principalId,
        String sessionId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for principal ID. */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /** MDC key for session ID. */
    public static final String MDC_SESSION_ID = "sessionId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static RequestContext of(String correlationId) {
        return new RequestContext(correlationId, null, null, null, null);
    }

    /** Returns a copy bound to the given tenant and principal. */
    public RequestContext withCaller(String tenantId, String principalId, String sessionId) {
        return new RequestContext(correlationId, tenantId, principalId, sessionId, requestId);
    }
}
