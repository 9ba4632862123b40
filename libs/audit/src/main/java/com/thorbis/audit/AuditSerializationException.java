package com.thorbis.audit;

/** Thrown when an audit entry cannot be converted to or from JSON. */
public class AuditSerializationException extends RuntimeException {

    public AuditSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
