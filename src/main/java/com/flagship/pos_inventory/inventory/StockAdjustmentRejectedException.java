package com.flagship.pos_inventory.inventory;

import lombok.Getter;

/**
 * Thrown when a conditional stock update touched no row: either the
 * adjustment would have taken stock below zero or the product has no
 * inventory record. The ledger cannot tell the two apart; callers that
 * care check product existence first.
 *
 * Thrown inside a unit of work, so it rolls back everything written so far.
 */
@Getter
public class StockAdjustmentRejectedException extends RuntimeException {

    private final String productCode;
    private final int delta;

    public StockAdjustmentRejectedException(String productCode, int delta) {
        super(String.format("Adjustment of %+d for %s would result in negative stock or product not found",
            delta, productCode));
        this.productCode = productCode;
        this.delta = delta;
    }

    public boolean isDecrement() {
        return delta < 0;
    }
}
