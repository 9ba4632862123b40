package com.thorbis.security.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;

/**
 * Jackson mapping for {@link PolicyDocument}. Unknown properties are rejected so a typo in a
 * published document fails the reload instead of silently dropping a constraint.
 */
public final class PolicyJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PolicyJson() {
        // utility class
    }

    public static PolicyDocument read(InputStream json, String origin) {
        try {
            return MAPPER.readValue(json, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyLoadException("Cannot parse policy document " + origin + ": " + e.getMessage(), e);
        }
    }

    public static PolicyDocument read(String json) {
        try {
            return MAPPER.readValue(json, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyLoadException("Cannot parse policy document: " + e.getMessage(), e);
        }
    }

    public static String write(PolicyDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (IOException e) {
            throw new PolicyLoadException("Cannot serialize policy document " + document.industry(), e);
        }
    }
}
