package com.flagship.treasury_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.treasury_ledger.exception.TransientConflictException;
import com.flagship.treasury_ledger.exception.TreasuryException;
import com.flagship.treasury_ledger.ledger.RecordedTransaction;
import com.flagship.treasury_ledger.observability.CorrelationContext;
import com.flagship.treasury_ledger.observability.TreasuryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka listener for external deposit notifications.
 *
 * Offsets are committed manually. Unparseable messages and permanent
 * domain rejections are acknowledged so they do not block the partition;
 * transient failures are rethrown and the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DepositEventConsumer {

    static final String CONSUMER_GROUP = "treasury-deposit-consumer";
    static final String EVENT_TYPE = "ExternalDeposit";

    private final IdempotentEventProcessor eventProcessor;
    private final DepositEventHandler handler;
    private final ObjectMapper objectMapper;
    private final TreasuryMetrics metrics;

    @KafkaListener(
        topics = "${kafka.topic.deposits:treasury-deposits}",
        groupId = "${spring.kafka.consumer.group-id:treasury-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        ExternalDepositNotification notification = parse(record.value());
        if (notification == null || notification.getEventId() == null) {
            log.warn("Could not parse deposit notification at offset {}, acknowledging to skip", record.offset());
            metrics.recordEventProcessingFailure(EVENT_TYPE, "unparseable");
            ack.acknowledge();
            return;
        }

        CorrelationContext.begin(notification.getEventId().toString());
        try {
            IdempotentEventProcessor.ProcessingResult<RecordedTransaction> result = eventProcessor.process(
                notification.getEventId(), EVENT_TYPE, EVENT_TYPE, CONSUMER_GROUP,
                () -> handler.onExternalDeposit(notification),
                recorded -> recorded.getTransaction().getId());
            metrics.recordEventProcessed(EVENT_TYPE, result.wasProcessed());
            ack.acknowledge();
        } catch (TransientConflictException e) {
            metrics.recordEventProcessingFailure(EVENT_TYPE, e.getKind().name());
            log.warn("Transient failure on deposit event {}, leaving for redelivery", notification.getEventId());
            throw e;
        } catch (TreasuryException e) {
            metrics.recordEventProcessingFailure(EVENT_TYPE, e.getKind().name());
            eventProcessor.markFailed(notification.getEventId(), EVENT_TYPE, EVENT_TYPE, CONSUMER_GROUP,
                    e.getKind() + ": " + e.getMessage());
            ack.acknowledge();
        } finally {
            CorrelationContext.clear();
        }
    }

    private ExternalDepositNotification parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ExternalDepositNotification.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse deposit notification: {}", e.getOriginalMessage());
            return null;
        }
    }
}
