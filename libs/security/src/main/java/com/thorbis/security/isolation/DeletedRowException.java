package com.thorbis.security.isolation;

/**
 * Thrown when a write targets a row that is soft-deleted or purge-eligible. Deleted rows only move
 * forward through {@link RowState}.
 */
public class DeletedRowException extends RuntimeException {

    private final RowState state;

    public DeletedRowException(String resourceType, String resourceId, RowState state) {
        super("Row %s/%s is %s and cannot be written".formatted(resourceType, resourceId, state));
        this.state = state;
    }

    public RowState state() {
        return state;
    }
}
