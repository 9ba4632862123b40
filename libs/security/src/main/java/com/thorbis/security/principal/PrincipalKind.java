package com.thorbis.security.principal;

/** Whether a principal is a person or an integration partner. */
public enum PrincipalKind {
    HUMAN,
    API_PARTNER
}
