package com.flagship.treasury_ledger.reconciliation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_log")
@Getter
@Setter
@NoArgsConstructor
public class ReconciliationRecordEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "external_balance", nullable = false, precision = 20, scale = 8, updatable = false)
    private BigDecimal externalBalance;

    @Column(name = "external_source", updatable = false)
    private String source;

    @Column(name = "internal_total_balance", nullable = false, precision = 20, scale = 8, updatable = false)
    private BigDecimal internalTotal;

    @Column(name = "discrepancy", nullable = false, precision = 20, scale = 8, updatable = false)
    private BigDecimal discrepancy;

    @Column(name = "discrepancy_percentage", nullable = false, precision = 12, scale = 4, updatable = false)
    private BigDecimal discrepancyPercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30, updatable = false)
    private ReconciliationStatus status;

    @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Column(name = "performed_by", nullable = false, length = 100, updatable = false)
    private String performedBy;

    @Column(name = "computed_at", nullable = false, updatable = false)
    private Instant computedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public static ReconciliationRecordEntity fromDomain(ReconciliationRecord record) {
        ReconciliationRecordEntity entity = new ReconciliationRecordEntity();
        entity.setId(record.getId());
        entity.setExternalBalance(record.getExternalBalance());
        entity.setSource(record.getSource());
        entity.setInternalTotal(record.getInternalTotal());
        entity.setDiscrepancy(record.getDiscrepancy());
        entity.setDiscrepancyPercentage(record.getDiscrepancyPercentage());
        entity.setStatus(record.getStatus());
        entity.setNotes(record.getNotes());
        entity.setPerformedBy(record.getPerformedBy());
        entity.setComputedAt(record.getComputedAt());
        entity.setCreatedAt(record.getCreatedAt());
        entity.setResolutionNotes(record.getResolutionNotes());
        entity.setResolvedBy(record.getResolvedBy());
        entity.setResolvedAt(record.getResolvedAt());
        return entity;
    }

    public ReconciliationRecord toDomain() {
        return new ReconciliationRecord(id, externalBalance, source, internalTotal, discrepancy,
                discrepancyPercentage, status, notes, performedBy, computedAt, createdAt,
                resolutionNotes, resolvedBy, resolvedAt);
    }
}
