package com.flagship.treasury_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileRequest {

    @NotNull(message = "external_balance is required")
    @DecimalMin(value = "0", message = "external_balance must not be negative")
    @Digits(integer = 12, fraction = 8)
    @JsonProperty("external_balance")
    private BigDecimal externalBalance;

    @Size(max = 255)
    @JsonProperty("source")
    private String source;

    @JsonProperty("notes")
    private String notes;
}
