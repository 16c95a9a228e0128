package com.flagship.treasury_ledger.audit;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only access to the audit log. No delete or update queries exist
 * here: the table is a permanent record.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, UUID> {

    List<AuditEntryEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<AuditEntryEntity> findByEntityTypeOrderByCreatedAtDesc(AuditEntityType entityType, Pageable pageable);

    List<AuditEntryEntity> findByEntityIdOrderByCreatedAtDesc(UUID entityId, Pageable pageable);

    List<AuditEntryEntity> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
        AuditEntityType entityType, UUID entityId, Pageable pageable);

    long countByEntityTypeAndEntityIdAndAction(AuditEntityType entityType, UUID entityId, AuditAction action);
}
