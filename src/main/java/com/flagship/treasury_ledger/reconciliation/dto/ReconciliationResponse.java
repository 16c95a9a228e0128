package com.flagship.treasury_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.reconciliation.ReconciliationRecord;
import com.flagship.treasury_ledger.reconciliation.ReconciliationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_balance")
    BigDecimal externalBalance;

    @JsonProperty("external_source")
    String source;

    @JsonProperty("internal_total_balance")
    BigDecimal internalTotal;

    @JsonProperty("discrepancy")
    BigDecimal discrepancy;

    @JsonProperty("discrepancy_percentage")
    BigDecimal discrepancyPercentage;

    @JsonProperty("status")
    ReconciliationStatus status;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("performed_by")
    String performedBy;

    @JsonProperty("computed_at")
    Instant computedAt;

    @JsonProperty("resolution_notes")
    String resolutionNotes;

    @JsonProperty("resolved_by")
    String resolvedBy;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    public static ReconciliationResponse from(ReconciliationRecord record) {
        return ReconciliationResponse.builder()
            .id(record.getId())
            .externalBalance(record.getExternalBalance())
            .source(record.getSource())
            .internalTotal(record.getInternalTotal())
            .discrepancy(record.getDiscrepancy())
            .discrepancyPercentage(record.getDiscrepancyPercentage())
            .status(record.getStatus())
            .notes(record.getNotes())
            .performedBy(record.getPerformedBy())
            .computedAt(record.getComputedAt())
            .resolutionNotes(record.getResolutionNotes())
            .resolvedBy(record.getResolvedBy())
            .resolvedAt(record.getResolvedAt())
            .build();
    }
}
