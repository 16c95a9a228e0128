package com.flagship.treasury_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ledger, allocation and reconciliation metrics.
 *
 * Metrics exposed:
 * - treasury.transactions.recorded: counter by type and status
 * - treasury.allocations: counter by outcome (allocated, already_allocated, unallocated)
 * - treasury.reconciliations: counter by classification
 * - treasury.ledger.latency: timer by operation
 * - treasury.balance.total: gauge of the summed active balances, refreshed by {@link MetricsScheduler}
 */
@Component
public class TreasuryMetrics {

    private final MeterRegistry registry;
    private final AtomicReference<BigDecimal> totalBalance = new AtomicReference<>(BigDecimal.ZERO);

    public TreasuryMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("treasury.balance.total", totalBalance, ref -> ref.get().doubleValue())
                .description("Sum of all active logical account balances")
                .register(registry);
    }

    public void recordTransactionRecorded(String type, String status) {
        registry.counter("treasury.transactions.recorded",
                "type", sanitizeTag(type),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordAllocation(String outcome) {
        registry.counter("treasury.allocations", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReconciliation(String status) {
        registry.counter("treasury.reconciliations", "status", sanitizeTag(status)).increment();
    }

    public void recordLedgerLatency(String operation, long durationMs) {
        registry.timer("treasury.ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordTransientConflict(String operation) {
        registry.counter("treasury.ledger.conflicts", "operation", sanitizeTag(operation)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("event.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    public void updateTotalBalance(BigDecimal total) {
        totalBalance.set(total != null ? total : BigDecimal.ZERO);
    }

    /**
     * Caps tag cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
