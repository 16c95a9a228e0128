package com.flagship.treasury_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Input of {@link LedgerService#recordTransaction}. Status defaults to
 * COMPLETED when not given.
 */
@Value
@Builder
public class RecordTransactionCommand {
    TransactionType type;
    TransactionStatus status;
    BigDecimal amount;
    UUID fromAccountId;
    UUID toAccountId;
    UUID parentTransactionId;
    String externalReference;
    Map<String, String> metadata;
    String performedBy;
    String idempotencyKey;

    public TransactionStatus effectiveStatus() {
        return status != null ? status : TransactionStatus.COMPLETED;
    }
}
