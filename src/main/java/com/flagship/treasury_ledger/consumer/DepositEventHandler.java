package com.flagship.treasury_ledger.consumer;

import com.flagship.treasury_ledger.exception.InvalidTransactionShapeException;
import com.flagship.treasury_ledger.ledger.AccountService;
import com.flagship.treasury_ledger.ledger.LogicalAccount;
import com.flagship.treasury_ledger.ledger.RecordTransactionCommand;
import com.flagship.treasury_ledger.ledger.RecordedTransaction;
import com.flagship.treasury_ledger.ledger.TransactionMetadata;
import com.flagship.treasury_ledger.ledger.TransactionRecorder;
import com.flagship.treasury_ledger.ledger.TransactionStatus;
import com.flagship.treasury_ledger.ledger.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Turns an external deposit notification into a completed
 * EXTERNAL_DEPOSIT, which allocates in the same unit of work.
 *
 * The ledger idempotency key is derived from the event id, so a
 * redelivered notification replays the first deposit instead of
 * crediting twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositEventHandler {

    static final String IDEMPOTENCY_PREFIX = "deposit-event:";
    static final String CONSUMER_ACTOR = "deposit-consumer";
    static final String SOURCE_KAFKA = "kafka";

    private final TransactionRecorder recorder;
    private final AccountService accountService;

    public RecordedTransaction onExternalDeposit(ExternalDepositNotification notification) {
        if (notification.getEventId() == null || notification.getAccountName() == null) {
            throw new InvalidTransactionShapeException("Deposit notification needs eventId and accountName");
        }
        LogicalAccount pool = accountService.getAccountByName(notification.getAccountName());

        RecordTransactionCommand command = RecordTransactionCommand.builder()
            .type(TransactionType.EXTERNAL_DEPOSIT)
            .status(TransactionStatus.COMPLETED)
            .amount(notification.getAmount())
            .toAccountId(pool.getId())
            .externalReference(notification.getExternalReference())
            .metadata(Map.of(
                TransactionMetadata.SOURCE, SOURCE_KAFKA,
                TransactionMetadata.EVENT_ID, notification.getEventId().toString()))
            .performedBy(CONSUMER_ACTOR)
            .idempotencyKey(IDEMPOTENCY_PREFIX + notification.getEventId())
            .build();

        RecordedTransaction recorded = recorder.record(command);
        log.info("Deposit event {} recorded as transaction {} (allocation {}, replayed={})",
                notification.getEventId(),
                recorded.getTransaction().getId(),
                recorded.getAllocation() != null ? recorded.getAllocation().getStatus() : "none",
                recorded.isReplayed());
        return recorded;
    }
}
