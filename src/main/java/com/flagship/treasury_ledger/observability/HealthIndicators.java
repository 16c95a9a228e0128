package com.flagship.treasury_ledger.observability;

import com.flagship.treasury_ledger.outbox.OutboxService;
import com.flagship.treasury_ledger.treasury.ReserveStatus;
import com.flagship.treasury_ledger.treasury.TreasuryStatus;
import com.flagship.treasury_ledger.treasury.TreasuryStatusService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors.
 *
 * Only the database decides whether the ledger can serve writes, so these
 * report WARNING or DEGRADED instead of DOWN where the ledger keeps working.
 */
public class HealthIndicators {

    static final String WARNING = "WARNING";
    static final String DEGRADED = "DEGRADED";

    /**
     * Reserve share of the treasury against the configured minimum.
     */
    @Component("reserveHealth")
    public static class ReserveHealthIndicator implements HealthIndicator {

        private final TreasuryStatusService statusService;

        public ReserveHealthIndicator(TreasuryStatusService statusService) {
            this.statusService = statusService;
        }

        @Override
        public Health health() {
            TreasuryStatus status = statusService.currentStatus();
            ReserveStatus reserve = status.getReserve();
            Health.Builder builder = reserve.isHealthy() ? Health.up() : Health.status(WARNING);
            return builder
                    .withDetail("account", reserve.getAccountName())
                    .withDetail("percentage", reserve.getActualPercentage().toPlainString())
                    .withDetail("minimum", reserve.getMinimumPercentage().toPlainString())
                    .withDetail("mode", status.getMode())
                    .build();
        }
    }

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING = 1000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            long pending = outboxService.countUnpublished();
            int deadLettered = outboxService.findDeadLetterEvents().size();
            Health.Builder builder = pending < BACKLOG_WARNING && deadLettered == 0
                    ? Health.up()
                    : Health.status(WARNING);
            return builder
                    .withDetail("pending", pending)
                    .withDetail("deadLettered", deadLettered)
                    .build();
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final RedisConnectionFactory connectionFactory;

        public RedisHealthIndicator(RedisConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            try (RedisConnection connection = connectionFactory.getConnection()) {
                return Health.up().withDetail("ping", String.valueOf(connection.ping())).build();
            } catch (RuntimeException e) {
                // idempotency keys are still checked against the database
                return Health.status(DEGRADED).withException(e).build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                // events stay in the outbox until the broker is back
                return (producerMetrics > 0 ? Health.up() : Health.status(DEGRADED))
                        .withDetail("producerMetrics", producerMetrics)
                        .build();
            } catch (RuntimeException e) {
                return Health.status(DEGRADED).withException(e).build();
            }
        }
    }
}
