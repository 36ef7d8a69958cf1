package com.flagship.pos_inventory.posting;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One product/quantity/price entry of a cart or purchase order as submitted
 * by the caller. Line totals are always derived, never supplied.
 */
@Value
public class LineItem {
    String productCode;
    int quantity;
    BigDecimal unitPrice;

    private LineItem(String productCode, int quantity, BigDecimal unitPrice) {
        this.productCode = productCode;
        this.quantity = quantity;
        // Stored as NUMERIC(10,2)
        this.unitPrice = unitPrice == null ? null : unitPrice.setScale(2, RoundingMode.HALF_UP);
    }

    public static LineItem of(String productCode, int quantity, BigDecimal unitPrice) {
        return new LineItem(productCode, quantity, unitPrice);
    }

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
    }
}
