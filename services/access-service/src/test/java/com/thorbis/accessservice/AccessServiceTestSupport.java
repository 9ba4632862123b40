package com.thorbis.accessservice;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thorbis.security.principal.HmacTokenVerifier;
import java.time.Duration;
import java.time.Instant;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/** Opens sessions through the HTTP API the way the authentication front door does. */
public final class AccessServiceTestSupport {

    public static final String FRONT_DOOR = "auth-front-door";
    public static final String POLICY_ADMIN = "policy-admin";

    private final MockMvc mockMvc;
    private final HmacTokenVerifier tokens;
    private final ObjectMapper mapper = new ObjectMapper();

    public AccessServiceTestSupport(MockMvc mockMvc, HmacTokenVerifier tokens) {
        this.mockMvc = mockMvc;
        this.tokens = tokens;
    }

    /** Bearer header for a principal that holds no interactive session. */
    public String serviceBearer(String principalId) {
        return "Bearer " + tokens.issue(principalId, principalId + "-service",
                Instant.now().plus(Duration.ofHours(1)));
    }

    /** Opens a session and returns the created session document, including its token. */
    public JsonNode openSession(String principalId, String tenantId, String mfaLevel) throws Exception {
        String body = mapper.createObjectNode()
                .put("principalId", principalId)
                .put("tenantId", tenantId)
                .put("mfaLevel", mfaLevel)
                .toString();
        String response = mockMvc.perform(post("/api/v1/sessions")
                        .header("Authorization", serviceBearer(FRONT_DOOR))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return mapper.readTree(response);
    }

    /** Opens a session and returns its bearer header. */
    public String bearerFor(String principalId, String tenantId) throws Exception {
        return "Bearer " + openSession(principalId, tenantId, "NONE").get("token").asText();
    }

    public String json(Object value) throws Exception {
        return mapper.writeValueAsString(value);
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
