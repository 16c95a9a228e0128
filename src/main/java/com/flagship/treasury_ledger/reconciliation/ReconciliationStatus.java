package com.flagship.treasury_ledger.reconciliation;

import java.math.BigDecimal;

/**
 * Severity of a gap between the external balance and the internal total.
 */
public enum ReconciliationStatus {
    BALANCED,
    MINOR_DISCREPANCY,
    MAJOR_DISCREPANCY,
    CRITICAL;

    static final BigDecimal MINOR_LIMIT = BigDecimal.ONE;
    static final BigDecimal MAJOR_LIMIT = new BigDecimal("5");

    /**
     * Exact match is BALANCED. Otherwise the absolute percentage decides:
     * under 1 is minor, under 5 is major, anything else critical.
     */
    public static ReconciliationStatus classify(BigDecimal discrepancy, BigDecimal discrepancyPercentage) {
        if (discrepancy.signum() == 0) {
            return BALANCED;
        }
        BigDecimal magnitude = discrepancyPercentage.abs();
        if (magnitude.compareTo(MINOR_LIMIT) < 0) {
            return MINOR_DISCREPANCY;
        }
        if (magnitude.compareTo(MAJOR_LIMIT) < 0) {
            return MAJOR_DISCREPANCY;
        }
        return CRITICAL;
    }
}
