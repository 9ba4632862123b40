package com.thorbis.accessservice.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.thorbis.accessservice.AccessServiceTestSupport;
import com.thorbis.security.principal.HmacTokenVerifier;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("/api/v1/audit")
class AuditControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private HmacTokenVerifier tokens;

    private AccessServiceTestSupport support;

    @BeforeEach
    void setUp() {
        support = new AccessServiceTestSupport(mockMvc, tokens);
    }

    @Nested
    @DisplayName("POST /events")
    class RecordEvent {

        @Test
        @DisplayName("records a domain fact in the caller's tenant")
        void recordsDomainFact() throws Exception {
            String bearer = support.bearerFor("tech-1", "biz-1");

            mockMvc.perform(post("/api/v1/audit/events")
                            .header("Authorization", bearer)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(support.json(Map.of(
                                    "tenantId", "biz-1",
                                    "action", "estimate_approved",
                                    "resourceType", "estimate",
                                    "resourceId", "est-9",
                                    "severity", "MEDIUM"))))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.tenantId").value("biz-1"))
                    .andExpect(jsonPath("$.sequence").isNumber());
        }

        @Test
        @DisplayName("refuses to write into another tenant's partition")
        void refusesForeignPartition() throws Exception {
            String bearer = support.bearerFor("tech-1", "biz-1");

            mockMvc.perform(post("/api/v1/audit/events")
                            .header("Authorization", bearer)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(support.json(Map.of("tenantId", "biz-2", "action", "estimate_approved"))))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value("not_authorized"));
        }

        @Test
        @DisplayName("lets an API partner write into any tenant it is bound to")
        void partnerBoundTenant() throws Exception {
            var session = support.openSession("partner-quickbooks", "biz-1", "NONE");

            mockMvc.perform(post("/api/v1/audit/events")
                            .header("Authorization", "Bearer " + session.get("token").asText())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(support.json(Map.of("tenantId", "biz-2", "action", "invoice_synced"))))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.tenantId").value("biz-2"));
        }
    }

    @Nested
    @DisplayName("Audit trail")
    class Trail {

        @Test
        @DisplayName("an admin reads recorded facts, newest first")
        void adminReadsEntries() throws Exception {
            String tech = support.bearerFor("tech-1", "biz-1");
            mockMvc.perform(post("/api/v1/audit/events")
                            .header("Authorization", tech)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(support.json(Map.of("tenantId", "biz-1", "action", "invoice_sent"))))
                    .andExpect(status().isAccepted());

            mockMvc.perform(get("/api/v1/audit/{tenantId}/entries", "biz-1")
                            .param("eventType", "domain_event")
                            .param("limit", "1")
                            .header("Authorization", support.bearerFor("admin-1", "biz-1")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(1))
                    .andExpect(jsonPath("$[0].tenantId").value("biz-1"))
                    .andExpect(jsonPath("$[0].event.action").value("invoice_sent"))
                    .andExpect(jsonPath("$[0].event.principalId").value("tech-1"));
        }

        @Test
        @DisplayName("staff without the audit grant are refused")
        void staffRefused() throws Exception {
            mockMvc.perform(get("/api/v1/audit/{tenantId}/entries", "biz-1")
                            .header("Authorization", support.bearerFor("tech-1", "biz-1")))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value("not_authorized"));
        }

        @Test
        @DisplayName("an admin of one tenant cannot read another tenant's trail")
        void adminCannotReadForeignTrail() throws Exception {
            mockMvc.perform(get("/api/v1/audit/{tenantId}/entries", "biz-2")
                            .header("Authorization", support.bearerFor("admin-1", "biz-1")))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("verification reports an intact chain")
        void verification() throws Exception {
            mockMvc.perform(get("/api/v1/audit/{tenantId}/verification", "biz-1")
                            .header("Authorization", support.bearerFor("owner-1", "biz-1")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.tenantId").value("biz-1"))
                    .andExpect(jsonPath("$.intact").value(true))
                    .andExpect(jsonPath("$.gaps").isEmpty())
                    .andExpect(jsonPath("$.brokenLinks").isEmpty());
        }

        @Test
        @DisplayName("an unknown event type answers 400")
        void unknownEventType() throws Exception {
            mockMvc.perform(get("/api/v1/audit/{tenantId}/entries", "biz-1")
                            .param("eventType", "nonsense")
                            .header("Authorization", support.bearerFor("admin-1", "biz-1")))
                    .andExpect(status().isBadRequest());
        }
    }
}
