package com.flagship.pos_inventory.posting;

/**
 * Typed failure reasons returned by the posting engines.
 *
 * Each code belongs to one category which tells the caller whether the
 * request may be retried and what has to change first.
 */
public enum PostingErrorCode {

    EMPTY_CART(Category.VALIDATION),
    INVALID_LINE_ITEM(Category.VALIDATION),
    INVALID_DISCOUNT(Category.VALIDATION),
    CUSTOMER_NOT_FOUND(Category.VALIDATION),
    EMPLOYEE_NOT_FOUND(Category.VALIDATION),
    SUPPLIER_NOT_FOUND(Category.VALIDATION),
    PRODUCT_NOT_FOUND(Category.VALIDATION),
    PURCHASE_NOT_FOUND(Category.VALIDATION),

    INSUFFICIENT_STOCK(Category.BUSINESS_RULE),

    ALREADY_RECEIVED(Category.STATE_VIOLATION),
    CANNOT_CANCEL_RECEIVED(Category.STATE_VIOLATION),

    /**
     * Deadlock, lock timeout or serialization failure that survived the
     * unit of work's own retries. Safe to retry with backoff.
     */
    TRANSIENT_STORAGE_FAILURE(Category.STORAGE),

    /**
     * Constraint violation, connectivity loss or any other storage error.
     * The unit of work was rolled back in full.
     */
    STORAGE_FAILURE(Category.STORAGE);

    public enum Category {
        /** Rejected before any write. Fix the input and retry. */
        VALIDATION,
        /** Rejected by a business rule. Retry only once the underlying state changes. */
        BUSINESS_RULE,
        /** Illegal state transition. Re-fetch the current status. */
        STATE_VIOLATION,
        STORAGE
    }

    private final Category category;

    PostingErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return this == TRANSIENT_STORAGE_FAILURE;
    }
}
