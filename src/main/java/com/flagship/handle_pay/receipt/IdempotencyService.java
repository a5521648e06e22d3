package com.flagship.handle_pay.receipt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency key lookups for dispatcher calls.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the receipts table (the source of truth)
 * 3. Re-populate Redis on a database hit
 *
 * Redis failures are logged and never fail the request.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransferReceiptRepository receiptRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(TransferReceiptRepository receiptRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.receiptRepository = receiptRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the receipt ID previously stored under {@code idempotencyKey}, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String receiptId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (receiptId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(receiptId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> receiptId = receiptRepository.findByIdempotencyKey(idempotencyKey)
                .map(TransferReceiptEntity::getId);
        receiptId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return receiptId;
    }

    /**
     * Caches the key in Redis. The receipts table already holds it; inside a
     * transaction the cache write waits for the commit.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID receiptId) {
        requireKey(idempotencyKey);
        if (receiptId == null) {
            throw new IllegalArgumentException("Receipt ID cannot be null");
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, receiptId);
                }
            });
        } else {
            cache(idempotencyKey, receiptId);
        }
    }

    private void cache(String idempotencyKey, UUID receiptId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, receiptId.toString(), REDIS_TTL);
            log.debug("Cached idempotency key in Redis: {} -> {}", idempotencyKey, receiptId);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
