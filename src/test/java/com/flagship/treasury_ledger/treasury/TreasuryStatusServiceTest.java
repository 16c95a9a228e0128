package com.flagship.treasury_ledger.treasury;

import com.flagship.treasury_ledger.ledger.AccountType;
import com.flagship.treasury_ledger.ledger.LogicalAccount;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreasuryStatusServiceTest {

    private final TreasuryStatusService service =
        new TreasuryStatusService(null, "reserve", new BigDecimal("18"), "demo");

    private static LogicalAccount account(String name, AccountType type, String balance) {
        return new LogicalAccount(UUID.randomUUID(), name, type, null, new BigDecimal(balance), true,
            Instant.now(), Instant.now());
    }

    @Test
    void reserveAboveMinimumIsHealthy() {
        List<LogicalAccount> accounts = List.of(
            account("operating", AccountType.OPERATING, "800"),
            account("reserve", AccountType.RESERVE, "200"));

        ReserveStatus status = service.reserveStatus(accounts, new BigDecimal("1000"));

        assertEquals(new BigDecimal("20.0000"), status.getActualPercentage());
        assertTrue(status.isHealthy());
    }

    @Test
    void reserveExactlyAtMinimumIsHealthy() {
        List<LogicalAccount> accounts = List.of(
            account("operating", AccountType.OPERATING, "82"),
            account("reserve", AccountType.RESERVE, "18"));

        assertTrue(service.reserveStatus(accounts, new BigDecimal("100")).isHealthy());
    }

    @Test
    void reserveBelowMinimumIsUnhealthy() {
        List<LogicalAccount> accounts = List.of(
            account("operating", AccountType.OPERATING, "800"),
            account("reserve", AccountType.RESERVE, "100"));

        ReserveStatus status = service.reserveStatus(accounts, new BigDecimal("900"));

        assertEquals(new BigDecimal("11.1111"), status.getActualPercentage());
        assertFalse(status.isHealthy());
    }

    @Test
    void emptyTreasuryCountsAsHealthy() {
        List<LogicalAccount> accounts = List.of(account("reserve", AccountType.RESERVE, "0"));

        ReserveStatus status = service.reserveStatus(accounts, BigDecimal.ZERO);

        assertEquals(new BigDecimal("0.0000"), status.getActualPercentage());
        assertTrue(status.isHealthy());
    }

    @Test
    void missingReserveAccountCountsAsHealthy() {
        List<LogicalAccount> accounts = List.of(account("operating", AccountType.OPERATING, "50"));

        ReserveStatus status = service.reserveStatus(accounts, new BigDecimal("50"));

        assertEquals(0, status.getBalance().signum());
        assertTrue(status.isHealthy());
    }
}
