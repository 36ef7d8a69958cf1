package com.flagship.pos_inventory.inventory;

import lombok.Value;

/**
 * A product whose stock is at or below its minimum stock level.
 */
@Value
public class LowStockItem {
    String productCode;
    String productName;
    int currentStock;
    int minStockLevel;

    public int getShortfall() {
        return minStockLevel - currentStock;
    }
}
