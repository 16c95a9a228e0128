package com.flagship.treasury_ledger.reconciliation;

import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.event.ReconciliationRecordedEvent;
import com.flagship.treasury_ledger.exception.AlreadyResolvedException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.ledger.AccountService;
import com.flagship.treasury_ledger.observability.TreasuryMetrics;
import com.flagship.treasury_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares an external balance with the sum of active internal balances.
 *
 * Reconciliation only observes: it never corrects balances. Every run is
 * persisted, whatever its classification.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    public static final int MAX_HISTORY = 500;

    private final ReconciliationRecordRepository repository;
    private final AccountService accountService;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final TreasuryMetrics metrics;

    @Transactional
    public ReconciliationRecord reconcile(BigDecimal externalBalance, String source, String notes, String actor) {
        if (externalBalance == null || externalBalance.signum() < 0) {
            throw new IllegalArgumentException("external_balance must be zero or positive");
        }

        Instant computedAt = Instant.now();
        BigDecimal internalTotal = accountService.totalActiveBalance();
        ReconciliationRecord record = ReconciliationRecord.compute(
                externalBalance, internalTotal, source, notes, actor, computedAt);

        repository.save(ReconciliationRecordEntity.fromDomain(record));
        auditService.record(AuditEntityType.RECONCILIATION, record.getId(), AuditAction.CREATE,
                null, snapshot(record), actor);
        outboxService.saveEvent(ReconciliationRecordedEvent.from(record));
        metrics.recordReconciliation(record.getStatus().name());

        if (record.getStatus() == ReconciliationStatus.MAJOR_DISCREPANCY
                || record.getStatus() == ReconciliationStatus.CRITICAL) {
            log.warn("Reconciliation {} is {}: external={} internal={} discrepancy={} ({}%)",
                    record.getId(), record.getStatus(), externalBalance.toPlainString(),
                    internalTotal.toPlainString(), record.getDiscrepancy().toPlainString(),
                    record.getDiscrepancyPercentage().toPlainString());
        } else {
            log.info("Reconciliation {} is {} (discrepancy {})",
                    record.getId(), record.getStatus(), record.getDiscrepancy().toPlainString());
        }
        return record;
    }

    /**
     * @throws AlreadyResolvedException if a resolution is already attached
     */
    @Transactional
    public ReconciliationRecord resolve(UUID recordId, String resolutionNotes, String resolver) {
        ReconciliationRecordEntity entity = repository.findByIdForUpdate(recordId)
                .orElseThrow(() -> new NotFoundException("ReconciliationRecord", recordId));
        ReconciliationRecord current = entity.toDomain();
        if (current.isResolved()) {
            throw new AlreadyResolvedException(recordId);
        }

        ReconciliationRecord resolved = current.resolve(resolutionNotes, resolver);
        entity.setResolutionNotes(resolved.getResolutionNotes());
        entity.setResolvedBy(resolved.getResolvedBy());
        entity.setResolvedAt(resolved.getResolvedAt());
        repository.save(entity);

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("resolution_notes", resolutionNotes);
        after.put("resolved_by", resolver);
        after.put("resolved_at", resolved.getResolvedAt().toString());
        Map<String, Object> before = new LinkedHashMap<>();
        before.put("resolved_at", null);
        auditService.record(AuditEntityType.RECONCILIATION, recordId, AuditAction.UPDATE, before, after, resolver);

        log.info("Reconciliation {} resolved by {}", recordId, resolver);
        return resolved;
    }

    @Transactional(readOnly = true)
    public Optional<ReconciliationRecord> latest() {
        return repository.findFirstByOrderByCreatedAtDesc().map(ReconciliationRecordEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public ReconciliationRecord get(UUID recordId) {
        return repository.findById(recordId)
                .map(ReconciliationRecordEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("ReconciliationRecord", recordId));
    }

    /**
     * Newest first, optionally narrowed to one classification.
     */
    @Transactional(readOnly = true)
    public List<ReconciliationRecord> history(ReconciliationStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_HISTORY)));
        List<ReconciliationRecordEntity> rows = status != null
            ? repository.findByStatusOrderByCreatedAtDesc(status, page)
            : repository.findAllByOrderByCreatedAtDesc(page);
        return rows.stream().map(ReconciliationRecordEntity::toDomain).toList();
    }

    private static Map<String, Object> snapshot(ReconciliationRecord record) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("external_balance", record.getExternalBalance().toPlainString());
        values.put("external_source", record.getSource());
        values.put("internal_total_balance", record.getInternalTotal().toPlainString());
        values.put("discrepancy", record.getDiscrepancy().toPlainString());
        values.put("discrepancy_percentage", record.getDiscrepancyPercentage().toPlainString());
        values.put("status", record.getStatus().name());
        values.put("computed_at", record.getComputedAt().toString());
        return values;
    }
}
