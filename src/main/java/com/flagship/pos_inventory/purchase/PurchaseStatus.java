package com.flagship.pos_inventory.purchase;

/**
 * Lifecycle of a purchase order.
 *
 * PENDING --receive--> RECEIVED
 * PENDING --cancel---> CANCELLED
 */
public enum PurchaseStatus {
    /**
     * Ordered from the supplier, goods in transit. Stock is not touched yet.
     */
    PENDING,

    /**
     * Goods arrived and were added to stock. Terminal.
     */
    RECEIVED,

    /**
     * Terminal. Cancelled orders are deleted, so this status is never stored.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
