package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.event.DepositUnallocatedEvent;
import com.flagship.treasury_ledger.exception.InvalidStatusTransitionException;
import com.flagship.treasury_ledger.exception.InvalidTransactionShapeException;
import com.flagship.treasury_ledger.exception.NoApplicableRuleException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.observability.CorrelationContext;
import com.flagship.treasury_ledger.observability.TreasuryMetrics;
import com.flagship.treasury_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * The transaction ledger and sole writer of account balances.
 *
 * Every write runs in one database transaction: the row, its balance
 * effects, any allocation children, audit entries and outbox events
 * commit together or not at all.
 *
 * Retries on lock contention are applied one level up, by
 * {@link TransactionRecorder}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    public static final int AMOUNT_SCALE = 8;
    public static final int MAX_PAGE_SIZE = 100;
    public static final int DEFAULT_PAGE_SIZE = 50;

    private final LedgerTransactionRepository transactions;
    private final AccountService accountService;
    private final AllocationEngine allocationEngine;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final TreasuryMetrics metrics;

    /**
     * Validates and records a transaction. A transaction recorded as
     * COMPLETED moves balances immediately; a completed deposit is then
     * allocated in the same unit of work.
     *
     * @throws InvalidTransactionShapeException before any write, if the
     *         amount, type or account combination is not allowed
     * @throws NotFoundException if a referenced account or parent is missing
     */
    @Transactional
    public RecordedTransaction recordTransaction(RecordTransactionCommand command) {
        long start = System.currentTimeMillis();

        TransactionType type = command.getType();
        TransactionStatus status = command.effectiveStatus();
        BigDecimal amount = normalizeAmount(command.getAmount());

        if (type == null) {
            throw new InvalidTransactionShapeException("Transaction type is required");
        }
        if (type == TransactionType.INTERNAL_ALLOCATION) {
            throw new InvalidTransactionShapeException(
                "INTERNAL_ALLOCATION transactions are created by the allocation engine only");
        }
        type.validateShape(command.getFromAccountId(), command.getToAccountId());
        if (command.getFromAccountId() != null && command.getFromAccountId().equals(command.getToAccountId())) {
            throw new InvalidTransactionShapeException("Source and target account must differ");
        }
        if (command.getPerformedBy() == null || command.getPerformedBy().isBlank()) {
            throw new InvalidTransactionShapeException("performed_by is required");
        }
        if (command.getMetadata() != null && command.getMetadata().entrySet().stream()
                .anyMatch(e -> e.getKey() == null || e.getValue() == null)) {
            throw new InvalidTransactionShapeException("metadata keys and values must not be null");
        }

        requireActiveAccount(command.getFromAccountId());
        requireActiveAccount(command.getToAccountId());
        if (command.getParentTransactionId() != null && transactions.findById(command.getParentTransactionId()).isEmpty()) {
            throw new NotFoundException("LedgerTransaction", command.getParentTransactionId());
        }

        Instant now = Instant.now();
        LedgerTransaction tx = new LedgerTransaction(
            UUID.randomUUID(),
            type,
            status,
            amount,
            command.getFromAccountId(),
            command.getToAccountId(),
            command.getParentTransactionId(),
            command.getExternalReference(),
            command.getIdempotencyKey(),
            command.getMetadata() != null ? Map.copyOf(command.getMetadata()) : Map.of(),
            command.getPerformedBy(),
            now,
            status == TransactionStatus.COMPLETED ? now : null
        );

        CorrelationContext.enterTransaction(tx.getId());
        try {
            transactions.insert(tx);
            if (status == TransactionStatus.COMPLETED) {
                applyBalanceEffects(tx);
            }
            auditService.record(AuditEntityType.LEDGER_TRANSACTION, tx.getId(), AuditAction.CREATE,
                    null, snapshot(tx), tx.getPerformedBy());

            AllocationResult allocation = tx.isCompletedDeposit()
                ? allocateOrFlag(tx, tx.getPerformedBy())
                : null;

            metrics.recordTransactionRecorded(type.name(), status.name());
            metrics.recordLedgerLatency("record_transaction", System.currentTimeMillis() - start);
            log.info("Recorded {} {} of {} id={}", status, type, amount.toPlainString(), tx.getId());

            return new RecordedTransaction(tx, allocation, false);
        } finally {
            CorrelationContext.leaveTransaction();
        }
    }

    /**
     * Moves a PENDING transaction to COMPLETED, FAILED or CANCELLED. The
     * balance effects of a completion are applied here, and a completed
     * deposit is allocated.
     *
     * @throws InvalidStatusTransitionException for any other transition
     */
    @Transactional
    public RecordedTransaction updateStatus(UUID transactionId, TransactionStatus newStatus, String actor) {
        long start = System.currentTimeMillis();
        LedgerTransaction current = transactions.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new NotFoundException("LedgerTransaction", transactionId));

        if (newStatus == null || !current.getStatus().canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(transactionId, current.getStatus().name(),
                    String.valueOf(newStatus));
        }

        Instant completedAt = newStatus == TransactionStatus.COMPLETED ? Instant.now() : null;
        transactions.updateStatus(transactionId, newStatus, completedAt);
        LedgerTransaction updated = new LedgerTransaction(
            current.getId(), current.getType(), newStatus, current.getAmount(),
            current.getFromAccountId(), current.getToAccountId(), current.getParentTransactionId(),
            current.getExternalReference(), current.getIdempotencyKey(), current.getMetadata(),
            current.getPerformedBy(), current.getCreatedAt(), completedAt);

        if (newStatus == TransactionStatus.COMPLETED) {
            requireActiveAccount(updated.getFromAccountId());
            requireActiveAccount(updated.getToAccountId());
            applyBalanceEffects(updated);
        }

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("status", current.getStatus().name());
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("status", newStatus.name());
        if (completedAt != null) {
            after.put("completed_at", completedAt.toString());
        }
        auditService.record(AuditEntityType.LEDGER_TRANSACTION, transactionId, AuditAction.UPDATE,
                before, after, actor);

        AllocationResult allocation = updated.isCompletedDeposit() ? allocateOrFlag(updated, actor) : null;

        metrics.recordTransactionRecorded(updated.getType().name(), newStatus.name());
        metrics.recordLedgerLatency("update_status", System.currentTimeMillis() - start);
        log.info("Transaction {} moved {} -> {} by {}", transactionId, current.getStatus(), newStatus, actor);
        return new RecordedTransaction(updated, allocation, false);
    }

    /**
     * Administrative allocation retry for a completed deposit. Unlike the
     * recording path, a missing rule is reported to the caller.
     *
     * @throws NoApplicableRuleException if no active rule accepts the amount
     */
    @Transactional
    public AllocationResult allocateDeposit(UUID depositId, String actor) {
        long start = System.currentTimeMillis();
        AllocationResult result = allocationEngine.allocate(depositId, actor);
        metrics.recordLedgerLatency("allocate_deposit", System.currentTimeMillis() - start);
        return result;
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(UUID id) {
        return transactions.findById(id).orElseThrow(() -> new NotFoundException("LedgerTransaction", id));
    }

    /**
     * Current allocation state of a deposit: ALLOCATED with its children, or
     * UNALLOCATED when none exist.
     */
    @Transactional(readOnly = true)
    public AllocationResult getAllocations(UUID depositId) {
        LedgerTransaction deposit = getTransaction(depositId);
        List<AllocationResult.Share> shares = transactions.findAllocationShares(depositId);
        if (shares.isEmpty()) {
            return AllocationResult.unallocated(depositId,
                    deposit.isCompletedDeposit() ? "no allocation recorded" : "not a completed deposit");
        }
        Map<String, String> metadata = transactions.findAllocations(depositId).get(0).getMetadata();
        String ruleId = metadata.get(TransactionMetadata.ALLOCATION_RULE_ID);
        return AllocationResult.allocated(depositId, ruleId != null ? UUID.fromString(ruleId) : null,
                metadata.get(TransactionMetadata.ALLOCATION_RULE_NAME), shares);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findByIdempotencyKey(String idempotencyKey) {
        return transactions.findIdByIdempotencyKey(idempotencyKey);
    }

    /**
     * Newest first.
     *
     * @throws IllegalArgumentException if limit is outside 1..100 or offset is negative
     */
    @Transactional(readOnly = true)
    public TransactionPage listTransactions(TransactionFilter filter, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        TransactionFilter effective = filter != null ? filter : TransactionFilter.none();
        List<LedgerTransaction> items = transactions.find(effective, limit, offset);
        long total = transactions.count(effective);
        return new TransactionPage(items, total, limit, offset);
    }

    private AllocationResult allocateOrFlag(LedgerTransaction deposit, String actor) {
        try {
            return allocationEngine.allocate(deposit.getId(), actor);
        } catch (NoApplicableRuleException e) {
            String reason = e.getMessage();
            Map<String, Object> flagged = new LinkedHashMap<>();
            flagged.put(TransactionMetadata.UNALLOCATED_REASON, reason);
            auditService.record(AuditEntityType.LEDGER_TRANSACTION, deposit.getId(), AuditAction.EXECUTE,
                    null, flagged, actor);
            outboxService.saveEvent(DepositUnallocatedEvent.from(deposit, reason));
            metrics.recordAllocation(AllocationResult.Status.UNALLOCATED.name());
            log.warn("Deposit {} left unallocated: {}", deposit.getId(), reason);
            return AllocationResult.unallocated(deposit.getId(), reason);
        }
    }

    /**
     * Debit {@code from} and credit {@code to}, locking accounts in
     * ascending id order.
     */
    private void applyBalanceEffects(LedgerTransaction tx) {
        TreeMap<UUID, BigDecimal> deltas = new TreeMap<>();
        if (tx.getFromAccountId() != null) {
            deltas.merge(tx.getFromAccountId(), tx.getAmount().negate(), BigDecimal::add);
        }
        if (tx.getToAccountId() != null) {
            deltas.merge(tx.getToAccountId(), tx.getAmount(), BigDecimal::add);
        }
        for (Map.Entry<UUID, BigDecimal> delta : deltas.entrySet()) {
            accountService.adjustBalance(delta.getKey(), delta.getValue(), tx.getId());
        }
    }

    private void requireActiveAccount(UUID accountId) {
        if (accountId == null) {
            return;
        }
        LogicalAccount account = accountService.getAccount(accountId);
        if (!account.isActive()) {
            throw new NotFoundException("LogicalAccount", accountId);
        }
    }

    private static BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidTransactionShapeException("Amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new InvalidTransactionShapeException("Amount has more than " + AMOUNT_SCALE + " decimal places");
        }
        return amount.setScale(AMOUNT_SCALE, RoundingMode.UNNECESSARY);
    }

    static Map<String, Object> snapshot(LedgerTransaction tx) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("transaction_type", tx.getType().name());
        values.put("status", tx.getStatus().name());
        values.put("amount", tx.getAmount().toPlainString());
        values.put("from_account_id", tx.getFromAccountId() != null ? tx.getFromAccountId().toString() : null);
        values.put("to_account_id", tx.getToAccountId() != null ? tx.getToAccountId().toString() : null);
        values.put("parent_transaction_id",
                tx.getParentTransactionId() != null ? tx.getParentTransactionId().toString() : null);
        values.put("external_reference", tx.getExternalReference());
        values.put("metadata", tx.getMetadata());
        return values;
    }
}
