package com.flagship.treasury_ledger.observability;

import com.flagship.treasury_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relay metrics for treasury events.
 *
 * Metrics exposed:
 * - treasury.outbox.pending: events not yet relayed
 * - treasury.outbox.oldest.seconds: age of the oldest pending event
 * - treasury.outbox.dead_lettered: pending events past the retry limit
 * - treasury.outbox.relayed: counter by event type and outcome
 *
 * The gauges read a snapshot taken by {@link MetricsScheduler}.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry registry;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository, MeterRegistry registry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.registry = registry;
        this.maxRetries = maxRetries;

        Gauge.builder("treasury.outbox.pending", pending, AtomicLong::get)
                .description("Treasury events waiting to be relayed to Kafka")
                .register(registry);
        Gauge.builder("treasury.outbox.oldest.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Age of the oldest treasury event waiting to be relayed")
                .register(registry);
        Gauge.builder("treasury.outbox.dead_lettered", deadLettered, AtomicLong::get)
                .description("Treasury events that exhausted their relay attempts")
                .register(registry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));
            deadLettered.set(outboxRepository.countDeadLetterEvents(maxRetries));
        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox gauges: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        relayed(eventType, "published");
    }

    public void recordEventPublishFailed(String eventType) {
        relayed(eventType, "failed");
    }

    public void recordEventDeadLettered(String eventType) {
        relayed(eventType, "dead_lettered");
        log.error("Treasury event type {} reached the retry limit of {}; manual replay needed",
                eventType, maxRetries);
    }

    private void relayed(String eventType, String outcome) {
        registry.counter("treasury.outbox.relayed", "event_type", eventType, "outcome", outcome).increment();
    }
}
