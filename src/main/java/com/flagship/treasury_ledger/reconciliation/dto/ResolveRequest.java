package com.flagship.treasury_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequest {

    @NotBlank(message = "resolution_notes is required")
    @JsonProperty("resolution_notes")
    private String resolutionNotes;
}
