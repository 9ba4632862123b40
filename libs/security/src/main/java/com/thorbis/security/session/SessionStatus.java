package com.thorbis.security.session;

public enum SessionStatus {
    ACTIVE,
    TERMINATED
}
