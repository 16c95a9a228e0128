package com.flagship.treasury_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.LedgerTransaction;
import com.flagship.treasury_ledger.ledger.TransactionStatus;
import com.flagship.treasury_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("parent_transaction_id")
    UUID parentTransactionId;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("performed_by")
    String performedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static TransactionResponse from(LedgerTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .type(tx.getType())
            .status(tx.getStatus())
            .amount(tx.getAmount())
            .fromAccountId(tx.getFromAccountId())
            .toAccountId(tx.getToAccountId())
            .parentTransactionId(tx.getParentTransactionId())
            .externalReference(tx.getExternalReference())
            .metadata(tx.getMetadata())
            .performedBy(tx.getPerformedBy())
            .createdAt(tx.getCreatedAt())
            .completedAt(tx.getCompletedAt())
            .build();
    }
}
