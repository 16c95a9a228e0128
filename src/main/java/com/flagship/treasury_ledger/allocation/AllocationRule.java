package com.flagship.treasury_ledger.allocation;

import com.flagship.treasury_ledger.exception.InvalidRuleConfigurationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Percentage split applied to incoming deposits.
 *
 * Among active rules whose bounds contain a deposit amount, the lowest
 * {@code priority} value wins. Bounds are inclusive and either may be
 * absent.
 */
@Value
public class AllocationRule {

    public static final BigDecimal HUNDRED = new BigDecimal("100");
    static final int MAX_PERCENTAGE_SCALE = 2;

    UUID id;
    String name;
    boolean active;
    int priority;
    List<AllocationShare> shares;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    String description;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    public static AllocationRule create(String name, int priority, List<AllocationShare> shares,
                                        BigDecimal minAmount, BigDecimal maxAmount,
                                        String description, String createdBy) {
        Instant now = Instant.now();
        return new AllocationRule(UUID.randomUUID(), name, true, priority,
                shares == null ? List.of() : List.copyOf(shares),
                minAmount, maxAmount, description, createdBy, now, now);
    }

    public boolean accepts(BigDecimal amount) {
        if (minAmount != null && amount.compareTo(minAmount) < 0) {
            return false;
        }
        return maxAmount == null || amount.compareTo(maxAmount) <= 0;
    }

    public BigDecimal percentageSum() {
        return shares.stream().map(AllocationShare::getPercentage).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Checks the structural rules: at least one share, every percentage in
     * (0, 100] with at most two decimals, no account twice, total exactly
     * 100, and {@code minAmount <= maxAmount}.
     *
     * @throws InvalidRuleConfigurationException on the first violation
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidRuleConfigurationException("Rule name is required");
        }
        if (shares.isEmpty()) {
            throw new InvalidRuleConfigurationException("Rule '" + name + "' has no allocations");
        }

        Set<String> seen = new HashSet<>();
        for (AllocationShare share : shares) {
            if (share.getAccountName() == null || share.getAccountName().isBlank()) {
                throw new InvalidRuleConfigurationException("Allocation target account name is required");
            }
            BigDecimal pct = share.getPercentage();
            if (pct == null || pct.signum() <= 0 || pct.compareTo(HUNDRED) > 0) {
                throw new InvalidRuleConfigurationException(
                    "Percentage for '" + share.getAccountName() + "' must be greater than 0 and at most 100",
                    Map.of("account_name", share.getAccountName()));
            }
            if (pct.stripTrailingZeros().scale() > MAX_PERCENTAGE_SCALE) {
                throw new InvalidRuleConfigurationException(
                    "Percentage for '" + share.getAccountName() + "' has more than two decimal places",
                    Map.of("account_name", share.getAccountName()));
            }
            if (!seen.add(share.getAccountName())) {
                throw new InvalidRuleConfigurationException(
                    "Account '" + share.getAccountName() + "' appears more than once",
                    Map.of("account_name", share.getAccountName()));
            }
        }

        BigDecimal sum = percentageSum();
        if (sum.compareTo(HUNDRED) != 0) {
            throw new InvalidRuleConfigurationException(
                "Allocation percentages must sum to exactly 100, got " + sum.stripTrailingZeros().toPlainString(),
                Map.of("sum", sum.stripTrailingZeros().toPlainString()));
        }

        if (minAmount != null && minAmount.signum() < 0 || maxAmount != null && maxAmount.signum() < 0) {
            throw new InvalidRuleConfigurationException("Amount bounds must not be negative");
        }
        if (minAmount != null && maxAmount != null && minAmount.compareTo(maxAmount) > 0) {
            throw new InvalidRuleConfigurationException(
                "min_amount must not exceed max_amount",
                Map.of("min_amount", minAmount.toPlainString(), "max_amount", maxAmount.toPlainString()));
        }
    }

    public AllocationRule deactivate() {
        return new AllocationRule(id, name, false, priority, shares, minAmount, maxAmount,
                description, createdBy, createdAt, Instant.now());
    }
}
