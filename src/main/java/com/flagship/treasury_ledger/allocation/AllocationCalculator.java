package com.flagship.treasury_ledger.allocation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an amount by percentage shares without creating or losing value.
 *
 * Each share is floored to 8 decimal places; whatever the flooring leaves
 * over goes to the share with the highest percentage (the first one on
 * ties). The returned amounts always sum to the input exactly.
 */
public final class AllocationCalculator {

    public static final int AMOUNT_SCALE = 8;

    private AllocationCalculator() {
    }

    public static List<BigDecimal> split(BigDecimal amount, List<AllocationShare> shares) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
        if (shares == null || shares.isEmpty()) {
            throw new IllegalArgumentException("At least one share is required");
        }

        List<BigDecimal> amounts = new ArrayList<>(shares.size());
        BigDecimal allocated = BigDecimal.ZERO;
        int largest = 0;

        for (int i = 0; i < shares.size(); i++) {
            BigDecimal pct = shares.get(i).getPercentage();
            BigDecimal share = amount.multiply(pct)
                    .divide(AllocationRule.HUNDRED, AMOUNT_SCALE, RoundingMode.DOWN);
            amounts.add(share);
            allocated = allocated.add(share);
            if (pct.compareTo(shares.get(largest).getPercentage()) > 0) {
                largest = i;
            }
        }

        BigDecimal remainder = amount.setScale(AMOUNT_SCALE, RoundingMode.UNNECESSARY).subtract(allocated);
        if (remainder.signum() != 0) {
            amounts.set(largest, amounts.get(largest).add(remainder));
        }
        return amounts;
    }
}
