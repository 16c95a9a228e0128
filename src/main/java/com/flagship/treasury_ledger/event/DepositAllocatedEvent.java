package com.flagship.treasury_ledger.event;

import com.flagship.treasury_ledger.ledger.AllocationResult;
import com.flagship.treasury_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A completed deposit was split across its target accounts.
 */
@Value
public class DepositAllocatedEvent implements TreasuryEvent {
    public static final String EVENT_TYPE = "DepositAllocated";

    UUID eventId;
    UUID depositId;
    BigDecimal amount;
    UUID poolAccountId;
    UUID ruleId;
    String ruleName;
    List<Allocation> allocations;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return depositId;
    }

    @Override
    public String getAggregateType() {
        return "LedgerTransaction";
    }

    public static DepositAllocatedEvent from(LedgerTransaction deposit, AllocationResult result) {
        List<Allocation> allocations = result.getShares().stream()
                .map(s -> new Allocation(s.getTransactionId(), s.getAccountId(), s.getAccountName(),
                        s.getAmount(), s.getPercentage()))
                .toList();
        return new DepositAllocatedEvent(UUID.randomUUID(), deposit.getId(), deposit.getAmount(),
                deposit.getToAccountId(), result.getRuleId(), result.getRuleName(), allocations, Instant.now());
    }

    @Value
    public static class Allocation {
        UUID transactionId;
        UUID accountId;
        String accountName;
        BigDecimal amount;
        BigDecimal percentage;
    }
}
