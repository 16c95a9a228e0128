package com.flagship.treasury_ledger.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.AccountType;
import com.flagship.treasury_ledger.ledger.LogicalAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_name")
    String name;

    @JsonProperty("account_type")
    AccountType type;

    @JsonProperty("description")
    String description;

    @JsonProperty("current_balance")
    BigDecimal balance;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(LogicalAccount account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .type(account.getType())
            .description(account.getDescription())
            .balance(account.getBalance())
            .active(account.isActive())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
