package com.flagship.treasury_ledger.allocation;

import com.flagship.treasury_ledger.AbstractIntegrationTest;
import com.flagship.treasury_ledger.security.AccessGate;
import com.flagship.treasury_ledger.security.Roles;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AllocationRuleControllerTest extends AbstractIntegrationTest {

    private static final String LARGE_DEPOSIT_RULE = """
        {
          "rule_name": "large-deposit-split",
          "priority": 10,
          "min_amount": 10000,
          "allocations": [
            {"account_name": "reserve", "percentage": 60},
            {"account_name": "operating", "percentage": 40}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AccessGate accessGate;

    private String guardianHeader() {
        return "Bearer " + accessGate.issueToken("guardian-1", Roles.GUARDIAN, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("The seeded default rule is listed")
    void listsDefaultRule() throws Exception {
        mockMvc.perform(get("/allocation-rules").param("active_only", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].rule_name").value("default-deposit-split"))
            .andExpect(jsonPath("$[0].allocations.length()").value(5));

        mockMvc.perform(get("/allocation-rules/{id}", DEFAULT_RULE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_active").value(true));
    }

    @Test
    @DisplayName("Guardians create and deactivate rules")
    void createAndDeactivate() throws Exception {
        String created = mockMvc.perform(post("/allocation-rules")
                .header(HttpHeaders.AUTHORIZATION, guardianHeader())
                .contentType(MediaType.APPLICATION_JSON)
                .content(LARGE_DEPOSIT_RULE))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.rule_name").value("large-deposit-split"))
            .andExpect(jsonPath("$.priority").value(10))
            .andExpect(jsonPath("$.created_by").value("guardian-1"))
            .andReturn().getResponse().getContentAsString();
        String id = JsonPath.read(created, "$.id");

        mockMvc.perform(post("/allocation-rules")
                .header(HttpHeaders.AUTHORIZATION, guardianHeader())
                .contentType(MediaType.APPLICATION_JSON)
                .content(LARGE_DEPOSIT_RULE))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DUPLICATE_RULE"));

        mockMvc.perform(delete("/allocation-rules/{id}", id)
                .header(HttpHeaders.AUTHORIZATION, guardianHeader()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_active").value(false));

        mockMvc.perform(get("/audit-log")
                .param("entity_type", "ALLOCATION_RULE")
                .param("entity_id", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].action").value("DELETE"))
            .andExpect(jsonPath("$[1].action").value("CREATE"));
    }

    @Test
    @DisplayName("Percentages must total 100")
    void rejectsBadTotals() throws Exception {
        String body = """
            {
              "rule_name": "short-split",
              "allocations": [
                {"account_name": "reserve", "percentage": 50},
                {"account_name": "operating", "percentage": 49}
              ]
            }
            """;

        mockMvc.perform(post("/allocation-rules")
                .header(HttpHeaders.AUTHORIZATION, guardianHeader())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("INVALID_RULE_CONFIGURATION"))
            .andExpect(jsonPath("$.details.sum").value("99"));
    }

    @Test
    @DisplayName("Rule changes need a guardian token")
    void requiresGuardian() throws Exception {
        mockMvc.perform(post("/allocation-rules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(LARGE_DEPOSIT_RULE))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(delete("/allocation-rules/{id}", DEFAULT_RULE)
                .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("INVALID_TOKEN"));

        mockMvc.perform(delete("/allocation-rules/{id}", UUID.randomUUID())
                .header(HttpHeaders.AUTHORIZATION, guardianHeader()))
            .andExpect(status().isNotFound());
    }
}
