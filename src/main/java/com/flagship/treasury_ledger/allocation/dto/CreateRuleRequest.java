package com.flagship.treasury_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.allocation.AllocationShare;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of {@code POST /allocation-rules}. Percentage totals are checked by
 * the service, not here, so the caller gets INVALID_RULE_CONFIGURATION.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRuleRequest {

    @NotBlank(message = "rule_name is required")
    @Size(max = 100)
    @JsonProperty("rule_name")
    private String ruleName;

    @JsonProperty("priority")
    private Integer priority;

    @NotEmpty(message = "allocations must not be empty")
    @JsonProperty("allocations")
    private List<AllocationShare> allocations;

    @DecimalMin(value = "0")
    @JsonProperty("min_amount")
    private BigDecimal minAmount;

    @DecimalMin(value = "0")
    @JsonProperty("max_amount")
    private BigDecimal maxAmount;

    @JsonProperty("description")
    private String description;
}
