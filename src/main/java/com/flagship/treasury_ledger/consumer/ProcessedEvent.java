package com.flagship.treasury_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marks an inbound event as handled by one consumer group so that
 * redeliveries are skipped.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        // permanently rejected; redelivery will not be attempted again
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String aggregateType,
                                        String consumerGroup, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, null, consumerGroup,
                Instant.now(), ProcessingResult.FAILED, errorMessage);
    }
}
