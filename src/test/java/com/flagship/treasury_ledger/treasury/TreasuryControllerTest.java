package com.flagship.treasury_ledger.treasury;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.treasury_ledger.AbstractIntegrationTest;
import com.flagship.treasury_ledger.ledger.LedgerService;
import com.flagship.treasury_ledger.ledger.RecordTransactionCommand;
import com.flagship.treasury_ledger.ledger.TransactionStatus;
import com.flagship.treasury_ledger.ledger.TransactionType;
import com.flagship.treasury_ledger.security.AccessGate;
import com.flagship.treasury_ledger.security.Roles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TreasuryControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccessGate accessGate;

    @Autowired
    private LedgerService ledgerService;

    private String guardianHeader() {
        return "Bearer " + accessGate.issueToken("guardian-1", Roles.GUARDIAN, Duration.ofMinutes(5));
    }

    private void record(TransactionType type, String amount, UUID from, UUID to) {
        ledgerService.recordTransaction(RecordTransactionCommand.builder()
            .type(type)
            .status(TransactionStatus.COMPLETED)
            .amount(new BigDecimal(amount))
            .fromAccountId(from)
            .toAccountId(to)
            .performedBy("treasury-test")
            .build());
    }

    private JsonNode treasuryStatus() throws Exception {
        String body = mockMvc.perform(get("/treasury/status"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    @DisplayName("Status reports totals and reserve health as balances move")
    void statusTracksReserveHealth() throws Exception {
        printTestHeader("Treasury status");
        record(TransactionType.EXTERNAL_DEPOSIT, "1000", null, OPERATING);

        JsonNode healthy = treasuryStatus();
        printOutput("Status", healthy);

        assertEquals(0, healthy.get("total_balance").decimalValue().compareTo(new BigDecimal("1000")));
        assertEquals(5, healthy.get("accounts").size());
        assertEquals("reserve", healthy.at("/reserve_status/account_name").asText());
        assertEquals(0, healthy.at("/reserve_status/actual_reserve_percentage").decimalValue()
            .compareTo(new BigDecimal("20")));
        assertTrue(healthy.at("/reserve_status/is_healthy").asBoolean());
        assertEquals("demo", healthy.get("mode").asText());

        record(TransactionType.EXTERNAL_WITHDRAWAL, "100", RESERVE, null);

        JsonNode unhealthy = treasuryStatus();
        assertEquals(0, unhealthy.get("total_balance").decimalValue().compareTo(new BigDecimal("900")));
        assertFalse(unhealthy.at("/reserve_status/is_healthy").asBoolean());
        printSuccess("Reserve dropped below the minimum after the withdrawal");
    }

    @Test
    @DisplayName("Accounts are listed and looked up by id")
    void accounts() throws Exception {
        mockMvc.perform(get("/treasury/accounts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(5));

        mockMvc.perform(get("/treasury/accounts/{id}", RESERVE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account_name").value("reserve"))
            .andExpect(jsonPath("$.account_type").value("RESERVE"))
            .andExpect(jsonPath("$.is_active").value(true));

        mockMvc.perform(get("/treasury/accounts/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Creating an account needs a guardian and a unique name")
    void createAccount() throws Exception {
        String body = "{\"account_name\":\"grants\",\"account_type\":\"CUSTOM\",\"description\":\"Ecosystem grants\"}";

        mockMvc.perform(post("/treasury/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/treasury/accounts")
                .header(HttpHeaders.AUTHORIZATION, guardianHeader())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.account_name").value("grants"))
            .andExpect(jsonPath("$.account_type").value("CUSTOM"));

        mockMvc.perform(post("/treasury/accounts")
                .header(HttpHeaders.AUTHORIZATION, guardianHeader())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DUPLICATE_ACCOUNT"));

        mockMvc.perform(get("/audit-log").param("entity_type", "LOGICAL_ACCOUNT"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].action").value("CREATE"))
            .andExpect(jsonPath("$[0].performed_by").value("guardian-1"))
            .andExpect(jsonPath("$[0].new_values.account_name").value("grants"));
    }

    @Test
    @DisplayName("Health reports the database and the non-value-bearing mode")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.mode").value("demo"))
            .andExpect(jsonPath("$.non_value_bearing").value(true));
    }
}
