package com.flagship.treasury_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.AllocationResult;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class AllocationResponse {

    @JsonProperty("deposit_id")
    UUID depositId;

    @JsonProperty("status")
    AllocationResult.Status status;

    @JsonProperty("rule_id")
    UUID ruleId;

    @JsonProperty("rule_name")
    String ruleName;

    @JsonProperty("total_allocated")
    BigDecimal totalAllocated;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("allocations")
    List<Share> allocations;

    public static AllocationResponse from(AllocationResult result) {
        List<Share> shares = result.getShares().stream()
            .map(s -> new Share(s.getTransactionId(), s.getAccountId(), s.getAccountName(),
                s.getAmount(), s.getPercentage()))
            .toList();
        return new AllocationResponse(result.getDepositId(), result.getStatus(), result.getRuleId(),
            result.getRuleName(), result.totalAllocated(), result.getReason(), shares);
    }

    @Value
    public static class Share {
        @JsonProperty("transaction_id")
        UUID transactionId;
        @JsonProperty("account_id")
        UUID accountId;
        @JsonProperty("account_name")
        String accountName;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("percentage")
        BigDecimal percentage;
    }
}
