package com.flagship.treasury_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The handler commits its own work; the processed marker is written
 * afterwards. A crash between the two leads to a redelivery, so handlers
 * must be idempotent on their own (the deposit handler relies on the ledger
 * idempotency key for that).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @param aggregateIdOf extracts the id stored with the processed marker
     * @return SKIPPED without invoking the handler if the event was seen before
     */
    public <T> ProcessingResult<T> process(UUID eventId, String eventType, String aggregateType,
                                           String consumerGroup, Supplier<T> handler,
                                           Function<T, UUID> aggregateIdOf) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return ProcessingResult.skipped();
        }

        T result = handler.get();
        save(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateIdOf.apply(result), consumerGroup));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return ProcessingResult.success(result);
    }

    /**
     * Records a permanent rejection so redeliveries of the event are skipped.
     */
    public void markFailed(UUID eventId, String eventType, String aggregateType,
                           String consumerGroup, String errorMessage) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        save(ProcessedEvent.failed(eventId, eventType, aggregateType, consumerGroup, errorMessage));
        log.warn("Event {} rejected by consumer group {}: {}", eventId, consumerGroup, errorMessage);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    public Optional<ProcessedEvent> find(UUID eventId, String consumerGroup) {
        return repository.findByEventIdAndConsumerGroup(eventId, consumerGroup)
                .map(ProcessedEventEntity::toDomain);
    }

    public long count(String consumerGroup, ProcessedEvent.ProcessingResult result) {
        return repository.countByConsumerGroupAndProcessingResult(consumerGroup, result);
    }

    private void save(ProcessedEvent event) {
        try {
            repository.save(ProcessedEventEntity.fromDomain(event));
        } catch (DataIntegrityViolationException e) {
            // another instance wrote the marker first
            log.info("Event {} was marked processed concurrently ({})", event.getEventId(), e.getMostSpecificCause().getMessage());
        }
    }

    public static class ProcessingResult<T> {
        private final T value;
        private final boolean processed;

        private ProcessingResult(T value, boolean processed) {
            this.value = value;
            this.processed = processed;
        }

        public static <T> ProcessingResult<T> success(T value) {
            return new ProcessingResult<>(value, true);
        }

        public static <T> ProcessingResult<T> skipped() {
            return new ProcessingResult<>(null, false);
        }

        public T getValue() {
            return value;
        }

        public boolean wasProcessed() {
            return processed;
        }

        public boolean wasSkipped() {
            return !processed;
        }
    }
}
