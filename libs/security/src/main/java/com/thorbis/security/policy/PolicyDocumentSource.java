package com.thorbis.security.policy;

import java.util.List;

/** Where published policy documents are read from. */
public interface PolicyDocumentSource {

    /**
     * Loads every industry document of a version.
     *
     * @throws PolicyLoadException if the version does not exist or cannot be read
     */
    List<PolicyDocument> load(String version);
}
