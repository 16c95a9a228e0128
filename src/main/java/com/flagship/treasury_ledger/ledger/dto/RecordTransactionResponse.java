package com.flagship.treasury_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.RecordedTransaction;
import lombok.Value;

/**
 * A written transaction and, for completed deposits, its allocation.
 */
@Value
public class RecordTransactionResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("allocation")
    AllocationResponse allocation;

    @JsonProperty("replayed")
    boolean replayed;

    public static RecordTransactionResponse from(RecordedTransaction recorded) {
        return new RecordTransactionResponse(
            TransactionResponse.from(recorded.getTransaction()),
            recorded.getAllocation() != null ? AllocationResponse.from(recorded.getAllocation()) : null,
            recorded.isReplayed());
    }
}
