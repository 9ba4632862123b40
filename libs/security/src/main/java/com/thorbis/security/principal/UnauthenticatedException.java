package com.thorbis.security.principal;

/**
 * Thrown when a caller cannot be resolved to a principal. The message is for logs only; callers
 * receive a generic denial.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
