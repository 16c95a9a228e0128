package com.flagship.treasury_ledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/audit-log")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditEntryResponse>> list(
            @RequestParam(name = "entity_type", required = false) AuditEntityType entityType,
            @RequestParam(name = "entity_id", required = false) UUID entityId,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        List<AuditEntryResponse> body = auditService.find(entityType, entityId, limit).stream()
                .map(AuditEntryResponse::from)
                .toList();
        return ResponseEntity.ok(body);
    }

    @Value
    public static class AuditEntryResponse {
        UUID id;
        @JsonProperty("entity_type")
        AuditEntityType entityType;
        @JsonProperty("entity_id")
        UUID entityId;
        AuditAction action;
        @JsonProperty("old_values")
        Map<String, Object> oldValues;
        @JsonProperty("new_values")
        Map<String, Object> newValues;
        @JsonProperty("performed_by")
        String performedBy;
        @JsonProperty("created_at")
        Instant createdAt;

        static AuditEntryResponse from(AuditEntry entry) {
            return new AuditEntryResponse(entry.getId(), entry.getEntityType(), entry.getEntityId(),
                    entry.getAction(), entry.getOldValues(), entry.getNewValues(),
                    entry.getPerformedBy(), entry.getCreatedAt());
        }
    }
}
