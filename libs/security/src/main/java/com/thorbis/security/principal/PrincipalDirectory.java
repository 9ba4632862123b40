package com.thorbis.security.principal;

import java.util.Optional;

/** Source of truth for principals and their tenant bindings. */
public interface PrincipalDirectory {

    Optional<Principal> find(String principalId);
}
