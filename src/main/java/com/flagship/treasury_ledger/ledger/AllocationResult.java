package com.flagship.treasury_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of running the allocation engine against one deposit.
 */
@Value
public class AllocationResult {

    public enum Status {
        /** Children were written in this unit of work. */
        ALLOCATED,
        /** Children already existed and were returned unchanged. */
        ALREADY_ALLOCATED,
        /** No active rule matched; deposit stays completed and unallocated. */
        UNALLOCATED
    }

    UUID depositId;
    Status status;
    UUID ruleId;
    String ruleName;
    List<Share> shares;
    String reason;

    public static AllocationResult allocated(UUID depositId, UUID ruleId, String ruleName, List<Share> shares) {
        return new AllocationResult(depositId, Status.ALLOCATED, ruleId, ruleName, List.copyOf(shares), null);
    }

    public static AllocationResult alreadyAllocated(UUID depositId, UUID ruleId, String ruleName, List<Share> shares) {
        return new AllocationResult(depositId, Status.ALREADY_ALLOCATED, ruleId, ruleName, List.copyOf(shares), null);
    }

    public static AllocationResult unallocated(UUID depositId, String reason) {
        return new AllocationResult(depositId, Status.UNALLOCATED, null, null, List.of(), reason);
    }

    public BigDecimal totalAllocated() {
        return shares.stream().map(Share::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * One child INTERNAL_ALLOCATION transaction.
     */
    @Value
    public static class Share {
        UUID transactionId;
        UUID accountId;
        String accountName;
        BigDecimal amount;
        BigDecimal percentage;
    }
}
