package com.flagship.pos_inventory.idempotency;

/**
 * Document kind an idempotency key belongs to. Keys are unique per scope,
 * so the same key may be reused for a sale and a purchase.
 */
public enum IdempotencyScope {
    SALE("sale"),
    PURCHASE("purchase");

    private final String keyPrefix;

    IdempotencyScope(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String redisKey(String idempotencyKey) {
        return "idempotency:" + keyPrefix + ":" + idempotencyKey;
    }
}
