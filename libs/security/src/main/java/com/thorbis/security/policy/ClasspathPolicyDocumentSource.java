package com.thorbis.security.policy;

import com.thorbis.security.tenant.Industry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code <basePath>/<version>/<industry>.json} from the classpath. Industries without a
 * document in a version are skipped; a version with no documents at all is an error.
 */
public class ClasspathPolicyDocumentSource implements PolicyDocumentSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathPolicyDocumentSource.class);

    private final String basePath;
    private final ClassLoader classLoader;

    public ClasspathPolicyDocumentSource(String basePath) {
        this(basePath, ClasspathPolicyDocumentSource.class.getClassLoader());
    }

    public ClasspathPolicyDocumentSource(String basePath, ClassLoader classLoader) {
        String trimmed = basePath.startsWith("classpath:") ? basePath.substring("classpath:".length()) : basePath;
        trimmed = trimmed.replaceAll("^/+", "").replaceAll("/+$", "");
        this.basePath = trimmed;
        this.classLoader = classLoader;
    }

    @Override
    public List<PolicyDocument> load(String version) {
        if (version == null || version.isBlank() || version.contains("/") || version.contains("..")) {
            throw new PolicyLoadException("Invalid policy version '" + version + "'");
        }
        List<PolicyDocument> documents = new ArrayList<>();
        for (Industry industry : Industry.values()) {
            String resource = basePath + "/" + version + "/" + industry.value() + ".json";
            try (InputStream in = classLoader.getResourceAsStream(resource)) {
                if (in == null) {
                    continue;
                }
                documents.add(PolicyJson.read(in, resource));
                log.debug("Read policy document {}", resource);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot close " + resource, e);
            }
        }
        if (documents.isEmpty()) {
            throw new PolicyLoadException("No policy documents found for version " + version
                    + " under classpath:" + basePath);
        }
        return documents;
    }
}
