package com.thorbis.security.policy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link PolicyDocumentSource} fed programmatically, for tests and administrative publishing. */
public class InMemoryPolicyDocumentSource implements PolicyDocumentSource {

    private final Map<String, List<PolicyDocument>> versions = new ConcurrentHashMap<>();

    public InMemoryPolicyDocumentSource publish(String version, PolicyDocument... documents) {
        versions.put(version, List.of(documents));
        return this;
    }

    @Override
    public List<PolicyDocument> load(String version) {
        List<PolicyDocument> documents = versions.get(version);
        if (documents == null) {
            throw new PolicyLoadException("Unknown policy version " + version);
        }
        return documents;
    }
}
