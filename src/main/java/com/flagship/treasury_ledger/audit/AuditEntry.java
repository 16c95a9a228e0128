package com.flagship.treasury_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit trail record. Snapshots hold plain JSON values only
 * (strings, numbers, lists, nested maps).
 */
@Value
public class AuditEntry {
    UUID id;
    AuditEntityType entityType;
    UUID entityId;
    AuditAction action;
    Map<String, Object> oldValues;
    Map<String, Object> newValues;
    String performedBy;
    Instant createdAt;

    public static AuditEntry create(AuditEntityType entityType, UUID entityId, AuditAction action,
                                    Map<String, Object> oldValues, Map<String, Object> newValues,
                                    String performedBy) {
        return new AuditEntry(UUID.randomUUID(), entityType, entityId, action,
                oldValues, newValues, performedBy, Instant.now());
    }
}
