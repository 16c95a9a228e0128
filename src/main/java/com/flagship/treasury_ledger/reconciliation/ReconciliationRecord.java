package com.flagship.treasury_ledger.reconciliation;

import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * One comparison of the external balance against the internal total.
 *
 * Records are append-only; the only later change is attaching a
 * resolution.
 */
@Value
public class ReconciliationRecord {

    static final int PERCENTAGE_SCALE = 4;
    static final BigDecimal MIN_DENOMINATOR = new BigDecimal("0.00000001");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    UUID id;
    BigDecimal externalBalance;
    String source;
    BigDecimal internalTotal;
    BigDecimal discrepancy;
    BigDecimal discrepancyPercentage;
    ReconciliationStatus status;
    String notes;
    String performedBy;
    Instant computedAt;
    Instant createdAt;
    String resolutionNotes;
    String resolvedBy;
    Instant resolvedAt;

    /**
     * Computes discrepancy ({@code external - internal}), its signed
     * percentage of the internal total and the classification. A zero
     * internal total is treated as the smallest unit so the percentage
     * stays defined. Classification uses the unrounded percentage; the
     * stored figure is rounded to four places.
     */
    public static ReconciliationRecord compute(BigDecimal externalBalance, BigDecimal internalTotal,
                                               String source, String notes, String performedBy,
                                               Instant computedAt) {
        BigDecimal discrepancy = externalBalance.subtract(internalTotal);
        BigDecimal denominator = internalTotal.max(MIN_DENOMINATOR);
        BigDecimal exactPercentage = discrepancy.multiply(HUNDRED)
                .divide(denominator, MathContext.DECIMAL128);
        BigDecimal percentage = exactPercentage.setScale(PERCENTAGE_SCALE, RoundingMode.HALF_UP);

        return new ReconciliationRecord(
            UUID.randomUUID(),
            externalBalance,
            source,
            internalTotal,
            discrepancy,
            percentage,
            ReconciliationStatus.classify(discrepancy, exactPercentage),
            notes,
            performedBy,
            computedAt,
            Instant.now(),
            null,
            null,
            null
        );
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public ReconciliationRecord resolve(String resolutionNotes, String resolvedBy) {
        return new ReconciliationRecord(id, externalBalance, source, internalTotal, discrepancy,
                discrepancyPercentage, status, notes, performedBy, computedAt, createdAt,
                resolutionNotes, resolvedBy, Instant.now());
    }
}
