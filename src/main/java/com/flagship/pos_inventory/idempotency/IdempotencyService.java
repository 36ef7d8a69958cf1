package com.flagship.pos_inventory.idempotency;

import com.flagship.pos_inventory.purchase.PurchasePersistenceService;
import com.flagship.pos_inventory.sale.SaleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps Idempotency-Key headers of the create endpoints to the document they created.
 *
 * Strategy:
 * 1. Redis first (fast, may be unavailable)
 * 2. the idempotency_key column of the header tables (source of truth)
 *
 * Redis is never required: lookup and store failures are logged and the
 * database answer is used.
 */
@Service
@Slf4j
public class IdempotencyService {

    private final SaleRepository saleRepository;
    private final PurchasePersistenceService purchasePersistenceService;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(SaleRepository saleRepository,
                              PurchasePersistenceService purchasePersistenceService,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${pos.idempotency.ttl-days:7}") long ttlDays) {
        this.saleRepository = saleRepository;
        this.purchasePersistenceService = purchasePersistenceService;
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofDays(ttlDays);
    }

    /**
     * @return the invoice or purchase number created earlier with this key
     */
    public Optional<String> findExisting(IdempotencyScope scope, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        String redisKey = scope.redisKey(idempotencyKey);
        if (redisTemplate.isPresent()) {
            try {
                String documentNo = redisTemplate.get().opsForValue().get(redisKey);
                if (documentNo != null) {
                    log.debug("Idempotency key found in Redis: {}", redisKey);
                    return Optional.of(documentNo);
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for {}, falling back to database: {}", redisKey, e.getMessage());
            }
        }

        Optional<String> stored = scope == IdempotencyScope.SALE
            ? saleRepository.findInvoiceNoByIdempotencyKey(idempotencyKey)
            : purchasePersistenceService.findPurchaseNoByIdempotencyKey(idempotencyKey);

        stored.ifPresent(documentNo -> {
            log.debug("Idempotency key found in database: {}", redisKey);
            cache(redisKey, documentNo);
        });
        return stored;
    }

    /**
     * Caches the mapping in Redis. The database row written by the posting
     * already records the key.
     */
    public void remember(IdempotencyScope scope, String idempotencyKey, String documentNo) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (documentNo == null) {
            throw new IllegalArgumentException("Document number cannot be null");
        }
        cache(scope.redisKey(idempotencyKey), documentNo);
    }

    private void cache(String redisKey, String documentNo) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, documentNo, ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }
}
