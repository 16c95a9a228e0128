package com.flagship.treasury_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.allocation.AllocationRule;
import com.flagship.treasury_ledger.allocation.AllocationShare;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RuleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("rule_name")
    String ruleName;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("priority")
    int priority;

    @JsonProperty("allocations")
    List<AllocationShare> allocations;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static RuleResponse from(AllocationRule rule) {
        return RuleResponse.builder()
            .id(rule.getId())
            .ruleName(rule.getName())
            .active(rule.isActive())
            .priority(rule.getPriority())
            .allocations(rule.getShares())
            .minAmount(rule.getMinAmount())
            .maxAmount(rule.getMaxAmount())
            .description(rule.getDescription())
            .createdBy(rule.getCreatedBy())
            .createdAt(rule.getCreatedAt())
            .updatedAt(rule.getUpdatedAt())
            .build();
    }
}
