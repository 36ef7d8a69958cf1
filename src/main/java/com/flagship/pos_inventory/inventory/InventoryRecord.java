package com.flagship.pos_inventory.inventory;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Current stock of one product. One record per product, same lifecycle.
 *
 * Invariant: currentStock is never negative.
 */
@Value
public class InventoryRecord {
    String productCode;
    int currentStock;
    LocalDateTime lastUpdated;
}
