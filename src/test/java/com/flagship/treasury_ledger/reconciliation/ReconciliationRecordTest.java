package com.flagship.treasury_ledger.reconciliation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationRecordTest {

    private static ReconciliationRecord compute(String external, String internal) {
        return ReconciliationRecord.compute(new BigDecimal(external), new BigDecimal(internal),
                "wallet", null, "guardian-1", Instant.now());
    }

    @Test
    @DisplayName("Equal balances are BALANCED")
    void balanced() {
        ReconciliationRecord record = compute("1000", "1000");
        assertEquals(ReconciliationStatus.BALANCED, record.getStatus());
        assertEquals(0, record.getDiscrepancy().signum());
    }

    @Test
    @DisplayName("1005 against 1000 is a 0.5% minor discrepancy")
    void minor() {
        ReconciliationRecord record = compute("1005", "1000");
        assertEquals(ReconciliationStatus.MINOR_DISCREPANCY, record.getStatus());
        assertEquals(new BigDecimal("0.5000"), record.getDiscrepancyPercentage());
        assertEquals(0, record.getDiscrepancy().compareTo(new BigDecimal("5")));
    }

    @Test
    @DisplayName("10300 against 10000 is a 3% major discrepancy")
    void major() {
        ReconciliationRecord record = compute("10300", "10000");
        assertEquals(ReconciliationStatus.MAJOR_DISCREPANCY, record.getStatus());
        assertEquals(new BigDecimal("3.0000"), record.getDiscrepancyPercentage());
    }

    @Test
    @DisplayName("6% is critical, and shortfalls classify by magnitude")
    void criticalAndNegative() {
        assertEquals(ReconciliationStatus.CRITICAL, compute("1060", "1000").getStatus());

        ReconciliationRecord shortfall = compute("970", "1000");
        assertEquals(ReconciliationStatus.MAJOR_DISCREPANCY, shortfall.getStatus());
        assertEquals(new BigDecimal("-3.0000"), shortfall.getDiscrepancyPercentage());
    }

    @Test
    @DisplayName("Thresholds are exclusive upper bounds")
    void boundaries() {
        assertEquals(ReconciliationStatus.MAJOR_DISCREPANCY, compute("1010", "1000").getStatus());
        assertEquals(ReconciliationStatus.CRITICAL, compute("1050", "1000").getStatus());
    }

    @Test
    @DisplayName("A gap just under 1% stays minor even when the stored figure rounds to 1.0000")
    void classifiesBeforeRounding() {
        ReconciliationRecord record = compute("100999.95", "100000");
        assertEquals(new BigDecimal("1.0000"), record.getDiscrepancyPercentage());
        assertEquals(ReconciliationStatus.MINOR_DISCREPANCY, record.getStatus());

        ReconciliationRecord nearCritical = compute("104999.995", "100000");
        assertEquals(new BigDecimal("5.0000"), nearCritical.getDiscrepancyPercentage());
        assertEquals(ReconciliationStatus.MAJOR_DISCREPANCY, nearCritical.getStatus());
    }

    @Test
    @DisplayName("An empty treasury still yields a defined percentage")
    void zeroInternal() {
        ReconciliationRecord record = compute("1", "0");
        assertEquals(ReconciliationStatus.CRITICAL, record.getStatus());
        assertEquals(ReconciliationStatus.BALANCED, compute("0", "0").getStatus());
    }

    @Test
    @DisplayName("Resolving attaches notes and keeps the computed figures")
    void resolve() {
        ReconciliationRecord record = compute("1060", "1000");
        assertFalse(record.isResolved());

        ReconciliationRecord resolved = record.resolve("late wallet sync", "guardian-2");
        assertTrue(resolved.isResolved());
        assertNotNull(resolved.getResolvedAt());
        assertEquals(record.getDiscrepancy(), resolved.getDiscrepancy());
        assertEquals("guardian-2", resolved.getResolvedBy());
    }
}
