package com.thorbis.security.isolation;

/** Deletion is a state transition: {@code ACTIVE -> SOFT_DELETED -> PURGE_ELIGIBLE}. */
public enum RowState {
    ACTIVE,
    SOFT_DELETED,
    PURGE_ELIGIBLE
}
