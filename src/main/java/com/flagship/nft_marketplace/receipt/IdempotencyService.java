package com.flagship.nft_marketplace.receipt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Service for idempotency key management.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the receipts table (slower, but always available)
 * 3. Cache database hits in Redis for future lookups
 *
 * The receipts table is the source of truth: the key is written there in
 * the same transaction as the receipt it points to.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionReceiptRepository receiptRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(TransactionReceiptRepository receiptRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.receiptRepository = receiptRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Checks if an idempotency key has been used before.
     *
     * @param idempotencyKey The idempotency key to check
     * @return Optional containing the receipt sequence number if the key exists
     */
    public Optional<Long> checkIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(Long.parseLong(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<TransactionReceiptEntity> existing;
        try {
            existing = receiptRepository.findByIdempotencyKey(idempotencyKey);
        } catch (Exception e) {
            log.error("Database lookup failed for idempotency key: {}. Error: {}",
                    idempotencyKey, e.getMessage());
            throw new IllegalStateException("Failed to check idempotency key", e);
        }

        if (existing.isPresent()) {
            long sequenceNumber = existing.get().getSequenceNumber();
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, sequenceNumber);
            return Optional.of(sequenceNumber);
        }
        return Optional.empty();
    }

    /**
     * Caches a key mapping in Redis after its receipt was committed.
     * Best effort: the receipts table already holds the mapping.
     *
     * Inside a transaction the write waits for the commit, so a rolled-back
     * receipt never leaves a cached key behind.
     */
    public void storeIdempotencyKey(String idempotencyKey, long sequenceNumber) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, sequenceNumber);
                }
            });
            return;
        }
        cache(idempotencyKey, sequenceNumber);
    }

    private void cache(String idempotencyKey, long sequenceNumber) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, Long.toString(sequenceNumber), REDIS_TTL);
            log.debug("Cached idempotency key in Redis: {} -> #{}", idempotencyKey, sequenceNumber);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
