package com.flagship.treasury_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Optional criteria for listing transactions. A null field does not filter.
 * {@code accountId} matches either side of the transfer.
 */
@Value
@Builder
public class TransactionFilter {
    TransactionType type;
    TransactionStatus status;
    UUID accountId;
    UUID parentTransactionId;
    Instant createdFrom;
    Instant createdTo;

    public static TransactionFilter none() {
        return TransactionFilter.builder().build();
    }
}
