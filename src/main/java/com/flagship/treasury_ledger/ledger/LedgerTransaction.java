package com.flagship.treasury_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One row of the transaction ledger.
 *
 * Rows are append-mostly: once COMPLETED only {@code completedAt} is ever
 * set. INTERNAL_ALLOCATION rows always point at their parent deposit.
 */
@Value
public class LedgerTransaction {
    UUID id;
    TransactionType type;
    TransactionStatus status;
    BigDecimal amount;
    UUID fromAccountId;
    UUID toAccountId;
    UUID parentTransactionId;
    String externalReference;
    String idempotencyKey;
    Map<String, String> metadata;
    String performedBy;
    Instant createdAt;
    Instant completedAt;

    public boolean isCompletedDeposit() {
        return type == TransactionType.EXTERNAL_DEPOSIT && status == TransactionStatus.COMPLETED;
    }
}
