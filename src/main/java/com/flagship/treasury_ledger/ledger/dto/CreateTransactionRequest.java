package com.flagship.treasury_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.TransactionStatus;
import com.flagship.treasury_ledger.ledger.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Body of {@code POST /transactions}. Status defaults to COMPLETED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @NotNull(message = "Transaction type is required")
    @JsonProperty("type")
    private TransactionType type;

    @JsonProperty("status")
    private TransactionStatus status;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 12, fraction = 8, message = "Amount allows at most 8 decimal places")
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("from_account_id")
    private UUID fromAccountId;

    @JsonProperty("to_account_id")
    private UUID toAccountId;

    @JsonProperty("parent_transaction_id")
    private UUID parentTransactionId;

    @Size(max = 255)
    @JsonProperty("external_reference")
    private String externalReference;

    @JsonProperty("metadata")
    private Map<String, String> metadata;

    @NotBlank(message = "performed_by is required")
    @Size(max = 100)
    @JsonProperty("performed_by")
    private String performedBy;
}
