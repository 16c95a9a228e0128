package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.AbstractIntegrationTest;
import com.flagship.treasury_ledger.allocation.AllocationRuleService;
import com.flagship.treasury_ledger.allocation.AllocationShare;
import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.event.DepositAllocatedEvent;
import com.flagship.treasury_ledger.event.DepositUnallocatedEvent;
import com.flagship.treasury_ledger.exception.InsufficientFundsException;
import com.flagship.treasury_ledger.exception.InvalidRuleConfigurationException;
import com.flagship.treasury_ledger.exception.InvalidStatusTransitionException;
import com.flagship.treasury_ledger.exception.InvalidTransactionShapeException;
import com.flagship.treasury_ledger.exception.NoApplicableRuleException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.outbox.OutboxEvent;
import com.flagship.treasury_ledger.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Ledger write path against a real database: balance effects, deposit
 * allocation, rollback on failure and the status machine.
 */
class LedgerServiceTest extends AbstractIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private TransactionRecorder recorder;

    @Autowired
    private AllocationRuleService ruleService;

    @Autowired
    private AuditService auditService;

    @Autowired
    private OutboxService outboxService;

    private RecordedTransaction deposit(String amount) {
        return recorder.record(RecordTransactionCommand.builder()
            .type(TransactionType.EXTERNAL_DEPOSIT)
            .amount(new BigDecimal(amount))
            .toAccountId(OPERATING)
            .externalReference("wallet-tx-" + UUID.randomUUID())
            .performedBy("test")
            .build());
    }

    private void assertBalance(UUID accountId, String expected) {
        BigDecimal actual = balanceOf(accountId);
        assertEquals(0, actual.compareTo(new BigDecimal(expected)),
                "balance of " + accountId + " expected " + expected + " but was " + actual);
    }

    @Nested
    @DisplayName("Deposit allocation")
    class DepositAllocation {

        @Test
        @DisplayName("100.00 deposit is split 50/20/15/10/5 by the default rule")
        void defaultSplit() {
            printTestHeader("Default deposit split");
            printInput("Deposit", "100.00 -> operating");

            RecordedTransaction recorded = deposit("100.00");
            AllocationResult allocation = recorded.getAllocation();
            printOutput("Allocation", allocation);

            assertEquals(TransactionStatus.COMPLETED, recorded.getTransaction().getStatus());
            assertEquals(AllocationResult.Status.ALLOCATED, allocation.getStatus());
            assertEquals(DEFAULT_RULE, allocation.getRuleId());
            assertEquals(5, allocation.getShares().size());
            assertEquals(0, allocation.totalAllocated().compareTo(new BigDecimal("100")));

            assertBalance(OPERATING, "50");
            assertBalance(RESERVE, "20");
            assertBalance(REWARDS, "15");
            assertBalance(DEVELOPMENT, "10");
            assertBalance(MARKETING, "5");
            assertEquals(0, totalBalance().compareTo(new BigDecimal("100")));
            printSuccess("Balances match the default split");
        }

        @Test
        @DisplayName("Children point at the deposit, carry rule metadata and are audited")
        void childrenAndAudit() {
            UUID depositId = deposit("100.00").getTransaction().getId();

            TransactionPage children = ledgerService.listTransactions(
                TransactionFilter.builder().parentTransactionId(depositId).build(), 100, 0);
            assertEquals(5, children.getTotal());
            for (LedgerTransaction child : children.getItems()) {
                assertEquals(TransactionType.INTERNAL_ALLOCATION, child.getType());
                assertEquals(TransactionStatus.COMPLETED, child.getStatus());
                assertEquals(OPERATING, child.getFromAccountId());
                assertEquals(DEFAULT_RULE.toString(), child.getMetadata().get(TransactionMetadata.ALLOCATION_RULE_ID));
                assertNotNull(child.getMetadata().get(TransactionMetadata.PERCENTAGE));
                assertEquals(1, auditService.count(AuditEntityType.LEDGER_TRANSACTION, child.getId(), AuditAction.CREATE));
            }

            assertEquals(1, auditService.count(AuditEntityType.LEDGER_TRANSACTION, depositId, AuditAction.CREATE));
            assertEquals(1, auditService.count(AuditEntityType.LEDGER_TRANSACTION, depositId, AuditAction.EXECUTE));

            List<OutboxEvent> events = outboxService.getEventsForAggregate("LedgerTransaction", depositId);
            assertEquals(1, events.size());
            assertEquals(DepositAllocatedEvent.EVENT_TYPE, events.get(0).getEventType());
        }

        @Test
        @DisplayName("Allocating the same deposit again changes nothing")
        void reallocationIsNoOp() {
            printTestHeader("Idempotent re-allocation");
            RecordedTransaction first = deposit("100.00");
            UUID depositId = first.getTransaction().getId();

            AllocationResult again = ledgerService.allocateDeposit(depositId, "test");
            AllocationResult third = recorder.allocateDeposit(depositId, "test");
            printOutput("Second attempt", again.getStatus());

            assertEquals(AllocationResult.Status.ALREADY_ALLOCATED, again.getStatus());
            assertEquals(AllocationResult.Status.ALREADY_ALLOCATED, third.getStatus());
            assertEquals(5, again.getShares().size());
            assertEquals(5, ledgerService.listTransactions(
                TransactionFilter.builder().parentTransactionId(depositId).build(), 100, 0).getTotal());
            assertBalance(OPERATING, "50");
            assertBalance(RESERVE, "20");
            printSuccess("No duplicate children, balances unchanged");
        }

        @Test
        @DisplayName("Sub-unit deposits conserve value through the remainder")
        void remainderToLargestShare() {
            RecordedTransaction recorded = deposit("0.00000003");

            assertEquals(0, recorded.getAllocation().totalAllocated().compareTo(new BigDecimal("0.00000003")));
            assertBalance(OPERATING, "0.00000003");
            assertBalance(RESERVE, "0");
            assertEquals(0, totalBalance().compareTo(new BigDecimal("0.00000003")));
        }

        @Test
        @DisplayName("Lowest priority value wins among rules whose bounds contain the amount")
        void ruleSelection() {
            ruleService.createRule("large-deposits", 10,
                List.of(AllocationShare.of("reserve", "100")),
                new BigDecimal("1000"), null, "large deposits go to reserve", "test");

            deposit("500");
            assertBalance(OPERATING, "250");
            assertBalance(RESERVE, "100");

            RecordedTransaction large = deposit("1000");
            assertEquals("large-deposits", large.getAllocation().getRuleName());
            assertBalance(RESERVE, "1100");
            assertBalance(OPERATING, "250");
        }
    }

    @Nested
    @DisplayName("Unallocated deposits")
    class Unallocated {

        @Test
        @DisplayName("Without an applicable rule the deposit stays completed and is flagged")
        void noApplicableRule() {
            printTestHeader("No applicable rule");
            ruleService.deactivateRule(DEFAULT_RULE, "test");

            RecordedTransaction recorded = deposit("100.00");
            printOutput("Allocation", recorded.getAllocation());

            assertEquals(TransactionStatus.COMPLETED, recorded.getTransaction().getStatus());
            assertEquals(AllocationResult.Status.UNALLOCATED, recorded.getAllocation().getStatus());
            assertNotNull(recorded.getAllocation().getReason());
            assertBalance(OPERATING, "100");

            UUID depositId = recorded.getTransaction().getId();
            List<OutboxEvent> events = outboxService.getEventsForAggregate("LedgerTransaction", depositId);
            assertEquals(1, events.size());
            assertEquals(DepositUnallocatedEvent.EVENT_TYPE, events.get(0).getEventType());
            assertEquals(1, auditService.count(AuditEntityType.LEDGER_TRANSACTION, depositId, AuditAction.EXECUTE));
            assertEquals(AllocationResult.Status.UNALLOCATED, ledgerService.getAllocations(depositId).getStatus());
            printSuccess("Deposit kept and flagged for follow-up");
        }

        @Test
        @DisplayName("Explicit retry reports the missing rule, then allocates once a rule exists")
        void retryAfterRuleAdded() {
            ruleService.deactivateRule(DEFAULT_RULE, "test");
            UUID depositId = deposit("80").getTransaction().getId();

            assertThrows(NoApplicableRuleException.class, () -> recorder.allocateDeposit(depositId, "test"));
            assertBalance(OPERATING, "80");

            ruleService.createRule("half-and-half", 50,
                List.of(AllocationShare.of("operating", "50"), AllocationShare.of("reserve", "50")),
                null, null, null, "test");

            AllocationResult result = recorder.allocateDeposit(depositId, "test");
            assertEquals(AllocationResult.Status.ALLOCATED, result.getStatus());
            assertBalance(OPERATING, "40");
            assertBalance(RESERVE, "40");
        }
    }

    @Nested
    @DisplayName("Rejections and rollback")
    class Rejections {

        @Test
        @DisplayName("Overdrawing an account rolls back the whole transaction")
        void insufficientFunds() {
            printTestHeader("Insufficient funds");
            RecordTransactionCommand payment = RecordTransactionCommand.builder()
                .type(TransactionType.PAYMENT)
                .amount(new BigDecimal("10"))
                .fromAccountId(REWARDS)
                .toAccountId(MARKETING)
                .performedBy("test")
                .build();

            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                    () -> recorder.record(payment));
            printOutput("Exception", e.getMessage());

            assertEquals(0, ledgerService.listTransactions(TransactionFilter.none(), 10, 0).getTotal());
            assertBalance(REWARDS, "0");
            assertBalance(MARKETING, "0");
            printSuccess("Nothing was written");
        }

        @Test
        @DisplayName("Malformed shapes and amounts are rejected before any write")
        void invalidShapes() {
            assertThrows(InvalidTransactionShapeException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.EXTERNAL_DEPOSIT)
                    .amount(BigDecimal.TEN).fromAccountId(RESERVE).toAccountId(OPERATING).performedBy("test").build()));
            assertThrows(InvalidTransactionShapeException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.EXTERNAL_DEPOSIT)
                    .amount(BigDecimal.ZERO).toAccountId(OPERATING).performedBy("test").build()));
            assertThrows(InvalidTransactionShapeException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.EXTERNAL_DEPOSIT)
                    .amount(new BigDecimal("1.000000001")).toAccountId(OPERATING).performedBy("test").build()));
            assertThrows(InvalidTransactionShapeException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.INTERNAL_ALLOCATION)
                    .amount(BigDecimal.ONE).fromAccountId(OPERATING).toAccountId(RESERVE).performedBy("test").build()));
            assertThrows(InvalidTransactionShapeException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.FEE)
                    .amount(BigDecimal.ONE).fromAccountId(OPERATING).toAccountId(OPERATING).performedBy("test").build()));

            assertEquals(0, ledgerService.listTransactions(TransactionFilter.none(), 10, 0).getTotal());
        }

        @Test
        @DisplayName("A stored rule that no longer sums to 100 aborts the deposit")
        void corruptedRule() {
            printTestHeader("Rule drift detected at allocation time");
            jdbcTemplate.update("UPDATE allocation_rules SET allocations = ?::jsonb WHERE id = ?",
                    "[{\"account_name\":\"operating\",\"percentage\":99}]", DEFAULT_RULE);

            InvalidRuleConfigurationException e = assertThrows(InvalidRuleConfigurationException.class,
                    () -> deposit("100"));
            printOutput("Exception", e.getMessage());

            assertEquals(0, ledgerService.listTransactions(TransactionFilter.none(), 10, 0).getTotal());
            assertEquals(0, jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM ledger_transactions WHERE parent_transaction_id IS NOT NULL", Long.class));
            assertEquals(0, totalBalance().signum());
            printSuccess("Deposit and children rolled back");
        }

        @Test
        @DisplayName("Metadata with a null value is rejected")
        void nullMetadata() {
            Map<String, String> metadata = new HashMap<>();
            metadata.put("memo", null);

            assertThrows(InvalidTransactionShapeException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.EXTERNAL_DEPOSIT)
                    .amount(BigDecimal.TEN).toAccountId(OPERATING).metadata(metadata).performedBy("test").build()));
            assertEquals(0, totalBalance().signum());
        }

        @Test
        @DisplayName("Unknown accounts are not found")
        void unknownAccount() {
            assertThrows(NotFoundException.class, () -> ledgerService.recordTransaction(
                RecordTransactionCommand.builder().type(TransactionType.EXTERNAL_DEPOSIT)
                    .amount(BigDecimal.TEN).toAccountId(UUID.randomUUID()).performedBy("test").build()));
        }

        @Test
        @DisplayName("Page size outside 1..100 is rejected")
        void pageBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> ledgerService.listTransactions(TransactionFilter.none(), 101, 0));
            assertThrows(IllegalArgumentException.class,
                    () -> ledgerService.listTransactions(TransactionFilter.none(), 10, -1));
        }
    }

    @Nested
    @DisplayName("Status machine")
    class StatusMachine {

        @Test
        @DisplayName("A pending deposit moves no value until it completes")
        void pendingThenCompleted() {
            RecordedTransaction pending = recorder.record(RecordTransactionCommand.builder()
                .type(TransactionType.EXTERNAL_DEPOSIT)
                .status(TransactionStatus.PENDING)
                .amount(new BigDecimal("100"))
                .toAccountId(OPERATING)
                .performedBy("test")
                .build());
            assertNull(pending.getAllocation());
            assertNull(pending.getTransaction().getCompletedAt());
            assertEquals(0, totalBalance().signum());

            RecordedTransaction completed = recorder.updateStatus(
                pending.getTransaction().getId(), TransactionStatus.COMPLETED, "guardian");
            assertEquals(AllocationResult.Status.ALLOCATED, completed.getAllocation().getStatus());
            assertNotNull(completed.getTransaction().getCompletedAt());
            assertBalance(OPERATING, "50");
            assertBalance(MARKETING, "5");
        }

        @Test
        @DisplayName("Terminal transactions cannot change status")
        void terminalIsFinal() {
            UUID depositId = deposit("10").getTransaction().getId();

            assertThrows(InvalidStatusTransitionException.class,
                    () -> ledgerService.updateStatus(depositId, TransactionStatus.CANCELLED, "guardian"));
            assertEquals(TransactionStatus.COMPLETED, ledgerService.getTransaction(depositId).getStatus());
        }

        @Test
        @DisplayName("Cancelling a pending payment leaves balances alone")
        void cancelPending() {
            deposit("100");
            RecordedTransaction pending = recorder.record(RecordTransactionCommand.builder()
                .type(TransactionType.PAYMENT)
                .status(TransactionStatus.PENDING)
                .amount(new BigDecimal("30"))
                .fromAccountId(OPERATING)
                .toAccountId(REWARDS)
                .metadata(Map.of(TransactionMetadata.MEMO, "vendor invoice"))
                .performedBy("test")
                .build());

            RecordedTransaction cancelled = ledgerService.updateStatus(
                pending.getTransaction().getId(), TransactionStatus.CANCELLED, "guardian");

            assertEquals(TransactionStatus.CANCELLED, cancelled.getTransaction().getStatus());
            assertBalance(OPERATING, "50");
            assertBalance(REWARDS, "15");
        }
    }

    @Test
    @DisplayName("Active balances equal completed deposits minus completed withdrawals")
    void globalInvariant() {
        printTestHeader("Global invariant");
        deposit("100");
        deposit("250.5");
        recorder.record(RecordTransactionCommand.builder()
            .type(TransactionType.EXTERNAL_WITHDRAWAL)
            .amount(new BigDecimal("30"))
            .fromAccountId(OPERATING)
            .performedBy("test")
            .build());
        recorder.record(RecordTransactionCommand.builder()
            .type(TransactionType.PAYMENT)
            .amount(new BigDecimal("12.25"))
            .fromAccountId(RESERVE)
            .toAccountId(REWARDS)
            .performedBy("test")
            .build());

        BigDecimal deposits = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions " +
            "WHERE transaction_type = 'EXTERNAL_DEPOSIT' AND status = 'COMPLETED'", BigDecimal.class);
        BigDecimal withdrawals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions " +
            "WHERE transaction_type = 'EXTERNAL_WITHDRAWAL' AND status = 'COMPLETED'", BigDecimal.class);
        printOutput("Deposits", deposits);
        printOutput("Withdrawals", withdrawals);
        printOutput("Total balance", totalBalance());

        assertEquals(0, totalBalance().compareTo(deposits.subtract(withdrawals)));
        assertEquals(0, totalBalance().compareTo(new BigDecimal("320.5")));
        Integer negative = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM logical_accounts WHERE current_balance < 0", Integer.class);
        assertEquals(0, negative);
        assertTrue(ledgerService.listTransactions(TransactionFilter.builder()
            .type(TransactionType.INTERNAL_ALLOCATION).build(), 100, 0).getTotal() >= 10);
        printSuccess("Global invariant holds");
    }
}
