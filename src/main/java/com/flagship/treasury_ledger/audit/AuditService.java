package com.flagship.treasury_ledger.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes and reads the audit trail.
 *
 * {@link #record} must run inside the mutation it describes, so the entry
 * commits or rolls back together with the change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    public static final int MAX_LIMIT = 500;

    private final AuditEntryRepository repository;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(AuditEntityType entityType, UUID entityId, AuditAction action,
                             Map<String, Object> oldValues, Map<String, Object> newValues,
                             String performedBy) {
        AuditEntry entry = AuditEntry.create(entityType, entityId, action, oldValues, newValues, performedBy);
        repository.save(AuditEntryEntity.fromDomain(entry));
        log.debug("Audit {} {} {} by {}", action, entityType, entityId, performedBy);
        return entry;
    }

    /**
     * Newest entries first. Both filters are optional.
     */
    @Transactional(readOnly = true)
    public List<AuditEntry> find(AuditEntityType entityType, UUID entityId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
        List<AuditEntryEntity> rows;
        if (entityType != null && entityId != null) {
            rows = repository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(entityType, entityId, page);
        } else if (entityType != null) {
            rows = repository.findByEntityTypeOrderByCreatedAtDesc(entityType, page);
        } else if (entityId != null) {
            rows = repository.findByEntityIdOrderByCreatedAtDesc(entityId, page);
        } else {
            rows = repository.findAllByOrderByCreatedAtDesc(page);
        }
        return rows.stream().map(AuditEntryEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public long count(AuditEntityType entityType, UUID entityId, AuditAction action) {
        return repository.countByEntityTypeAndEntityIdAndAction(entityType, entityId, action);
    }
}
