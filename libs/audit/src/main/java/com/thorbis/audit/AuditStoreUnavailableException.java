package com.thorbis.audit;

/** Thrown by an {@link AuditStore} that cannot accept writes. The recorder buffers and retries. */
public class AuditStoreUnavailableException extends RuntimeException {

    public AuditStoreUnavailableException(String message) {
        super(message);
    }

    public AuditStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
