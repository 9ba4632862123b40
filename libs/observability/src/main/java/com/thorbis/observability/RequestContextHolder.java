package com.thorbis.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for the current {@link RequestContext}, bridged to SLF4J MDC.
 * <p>
 * Setting a context populates the MDC keys declared on {@link RequestContext}; clearing removes
 * them. Work handed to another thread (audit retries, session sweeps) must carry the context
 * explicitly through {@link #callWithContext(RequestContext, Supplier)}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
        // utility class
    }

    /**
     * Binds the context to the current thread and mirrors it into MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(RequestContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(RequestContext.MDC_TENANT_ID, context.tenantId());
        putOrRemove(RequestContext.MDC_PRINCIPAL_ID, context.principalId());
        putOrRemove(RequestContext.MDC_SESSION_ID, context.sessionId());
        putOrRemove(RequestContext.MDC_REQUEST_ID, context.requestId());
    }

    /** Returns the current thread's context, if one is bound. */
    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current correlation ID, or {@code null} outside of a request. */
    public static String currentCorrelationId() {
        RequestContext context = CONTEXT.get();
        return context != null ? context.correlationId() : null;
    }

    /** Unbinds the context and removes every MDC key it populated. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(RequestContext.MDC_CORRELATION_ID);
        MDC.remove(RequestContext.MDC_TENANT_ID);
        MDC.remove(RequestContext.MDC_PRINCIPAL_ID);
        MDC.remove(RequestContext.MDC_SESSION_ID);
        MDC.remove(RequestContext.MDC_REQUEST_ID);
    }

    /**
     * Runs the supplier with the given context bound, then restores whatever was bound before.
     *
     * @return the supplier's result
     */
    public static <T> T callWithContext(RequestContext context, Supplier<T> work) {
        RequestContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
