package com.flagship.treasury_ledger.event;

import com.flagship.treasury_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A completed deposit matched no active allocation rule. The funds sit in
 * the deposit's target account until an operator retries the allocation.
 */
@Value
public class DepositUnallocatedEvent implements TreasuryEvent {
    public static final String EVENT_TYPE = "DepositUnallocated";

    UUID eventId;
    UUID depositId;
    BigDecimal amount;
    UUID accountId;
    String reason;
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

    public static DepositUnallocatedEvent from(LedgerTransaction deposit, String reason) {
        return new DepositUnallocatedEvent(UUID.randomUUID(), deposit.getId(), deposit.getAmount(),
                deposit.getToAccountId(), reason, Instant.now());
    }
}
