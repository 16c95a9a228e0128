package com.flagship.treasury_ledger.reconciliation;

import com.flagship.treasury_ledger.AbstractIntegrationTest;
import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.event.ReconciliationRecordedEvent;
import com.flagship.treasury_ledger.exception.AlreadyResolvedException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.ledger.RecordTransactionCommand;
import com.flagship.treasury_ledger.ledger.TransactionRecorder;
import com.flagship.treasury_ledger.ledger.TransactionType;
import com.flagship.treasury_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationServiceTest extends AbstractIntegrationTest {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private TransactionRecorder recorder;

    @Autowired
    private AuditService auditService;

    @Autowired
    private OutboxService outboxService;

    @BeforeEach
    void fundTreasury() {
        recorder.record(RecordTransactionCommand.builder()
            .type(TransactionType.EXTERNAL_DEPOSIT)
            .amount(new BigDecimal("10000"))
            .toAccountId(OPERATING)
            .performedBy("test")
            .build());
    }

    @Test
    @DisplayName("Matching external balance is recorded as BALANCED")
    void balanced() {
        printTestHeader("Balanced reconciliation");
        ReconciliationRecord record = reconciliationService.reconcile(
            new BigDecimal("10000"), "cold-wallet", "daily check", "guardian-1");
        printOutput("Record", record);

        assertEquals(ReconciliationStatus.BALANCED, record.getStatus());
        assertEquals(0, record.getInternalTotal().compareTo(new BigDecimal("10000")));
        assertEquals(1, auditService.count(AuditEntityType.RECONCILIATION, record.getId(), AuditAction.CREATE));
        assertEquals(ReconciliationRecordedEvent.EVENT_TYPE,
            outboxService.getEventsForAggregate("Reconciliation", record.getId()).get(0).getEventType());
    }

    @Test
    @DisplayName("A 3% surplus is major and balances are left untouched")
    void majorDoesNotCorrect() {
        ReconciliationRecord record = reconciliationService.reconcile(
            new BigDecimal("10300"), "cold-wallet", null, "guardian-1");

        assertEquals(ReconciliationStatus.MAJOR_DISCREPANCY, record.getStatus());
        assertEquals(new BigDecimal("3.0000"), record.getDiscrepancyPercentage());
        assertEquals(0, totalBalance().compareTo(new BigDecimal("10000")));
    }

    @Test
    @DisplayName("Latest and history return newest first and filter by status")
    void latestAndHistory() throws InterruptedException {
        reconciliationService.reconcile(new BigDecimal("10000"), "w", null, "guardian-1");
        Thread.sleep(5);
        reconciliationService.reconcile(new BigDecimal("10050"), "w", null, "guardian-1");
        Thread.sleep(5);
        ReconciliationRecord last = reconciliationService.reconcile(new BigDecimal("20000"), "w", null, "guardian-1");

        assertEquals(last.getId(), reconciliationService.latest().orElseThrow().getId());
        List<ReconciliationRecord> history = reconciliationService.history(null, 10);
        assertEquals(3, history.size());
        assertEquals(ReconciliationStatus.CRITICAL, history.get(0).getStatus());
        assertEquals(1, reconciliationService.history(ReconciliationStatus.MINOR_DISCREPANCY, 10).size());
    }

    @Test
    @DisplayName("A record resolves once")
    void resolveOnce() {
        ReconciliationRecord record = reconciliationService.reconcile(
            new BigDecimal("11000"), "cold-wallet", null, "guardian-1");

        ReconciliationRecord resolved = reconciliationService.resolve(record.getId(), "pending withdrawal", "guardian-2");
        assertTrue(resolved.isResolved());
        assertEquals("guardian-2", reconciliationService.get(record.getId()).getResolvedBy());
        assertEquals(1, auditService.count(AuditEntityType.RECONCILIATION, record.getId(), AuditAction.UPDATE));

        assertThrows(AlreadyResolvedException.class,
            () -> reconciliationService.resolve(record.getId(), "again", "guardian-3"));
        assertThrows(NotFoundException.class,
            () -> reconciliationService.resolve(UUID.randomUUID(), "missing", "guardian-2"));
    }

    @Test
    @DisplayName("Negative external balances are rejected")
    void negativeExternal() {
        assertThrows(IllegalArgumentException.class,
            () -> reconciliationService.reconcile(new BigDecimal("-1"), "w", null, "guardian-1"));
    }
}
