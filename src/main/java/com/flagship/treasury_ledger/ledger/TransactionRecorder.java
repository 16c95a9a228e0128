package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.exception.TransientConflictException;
import com.flagship.treasury_ledger.observability.TreasuryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for ledger writes from the API and the deposit consumer.
 *
 * Each attempt runs a fresh {@link LedgerService} transaction. Lock
 * conflicts and idempotency-key collisions are retried with exponential
 * backoff; a retry after a key collision finds the winning row and
 * returns it as a replay. When attempts run out the caller gets
 * {@link TransientConflictException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionRecorder {

    private final LedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final TreasuryMetrics metrics;

    @Retryable(
        retryFor = {ConcurrencyFailureException.class, DuplicateKeyException.class},
        maxAttempts = 4,
        backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 400)
    )
    public RecordedTransaction record(RecordTransactionCommand command) {
        String key = command.getIdempotencyKey();
        if (key != null) {
            Optional<UUID> existing = idempotencyService.checkIdempotencyKey(key);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key {} replays transaction {}", key, existing.get());
                return replay(existing.get());
            }
            metrics.recordIdempotencyMiss();
        }

        RecordedTransaction recorded = ledgerService.recordTransaction(command);
        if (key != null) {
            idempotencyService.storeIdempotencyKey(key, recorded.getTransaction().getId());
        }
        return recorded;
    }

    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttempts = 4,
        backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 400)
    )
    public RecordedTransaction updateStatus(UUID transactionId, TransactionStatus status, String actor) {
        return ledgerService.updateStatus(transactionId, status, actor);
    }

    @Retryable(
        retryFor = {ConcurrencyFailureException.class, DuplicateKeyException.class},
        maxAttempts = 4,
        backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 400)
    )
    public AllocationResult allocateDeposit(UUID depositId, String actor) {
        return ledgerService.allocateDeposit(depositId, actor);
    }

    @Recover
    public RecordedTransaction recoverRecord(RuntimeException e, RecordTransactionCommand command) {
        throw exhausted("record_transaction", e);
    }

    @Recover
    public RecordedTransaction recoverUpdateStatus(RuntimeException e, UUID transactionId,
                                                   TransactionStatus status, String actor) {
        throw exhausted("update_status", e);
    }

    @Recover
    public AllocationResult recoverAllocate(RuntimeException e, UUID depositId, String actor) {
        throw exhausted("allocate_deposit", e);
    }

    private RecordedTransaction replay(UUID transactionId) {
        LedgerTransaction tx = ledgerService.getTransaction(transactionId);
        AllocationResult allocation = tx.isCompletedDeposit() ? ledgerService.getAllocations(transactionId) : null;
        return new RecordedTransaction(tx, allocation, true);
    }

    /**
     * Non-transient failures pass through untouched.
     */
    private RuntimeException exhausted(String operation, RuntimeException e) {
        if (e instanceof ConcurrencyFailureException || e instanceof DuplicateKeyException) {
            metrics.recordTransientConflict(operation);
            log.warn("Giving up on {} after retries: {}", operation, e.getMessage());
            return new TransientConflictException(operation, e);
        }
        return e;
    }
}
