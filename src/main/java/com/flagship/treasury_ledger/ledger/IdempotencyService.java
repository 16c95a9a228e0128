package com.flagship.treasury_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps client idempotency keys to the transaction they created.
 *
 * Redis is only a fast path; the unique {@code idempotency_key} column of
 * the ledger is the source of truth, so a Redis outage costs latency and
 * never correctness.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerService ledgerService;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerService ledgerService, Optional<StringRedisTemplate> redisTemplate) {
        this.ledgerService = ledgerService;
        this.redisTemplate = redisTemplate;
    }

    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = REDIS_KEY_PREFIX + idempotencyKey;

        if (redisTemplate.isPresent()) {
            try {
                String transactionId = redisTemplate.get().opsForValue().get(redisKey);
                if (transactionId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(transactionId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing = ledgerService.findByIdempotencyKey(idempotencyKey);
        existing.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(redisKey, id);
        });
        return existing;
    }

    /**
     * Caches the mapping in Redis. The database row already holds the key.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        cache(REDIS_KEY_PREFIX + idempotencyKey, transactionId);
    }

    private void cache(String redisKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
