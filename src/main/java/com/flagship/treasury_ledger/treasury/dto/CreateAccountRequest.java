package com.flagship.treasury_ledger.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "account_name is required")
    @Size(max = 100)
    @JsonProperty("account_name")
    private String accountName;

    @NotNull(message = "account_type is required")
    @JsonProperty("account_type")
    private AccountType accountType;

    @JsonProperty("description")
    private String description;
}
