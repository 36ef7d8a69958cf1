package com.flagship.pos_inventory.purchase;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Most recent received purchase of one product: who supplied it, at what cost.
 */
@Value
public class LastPurchase {
    String productCode;
    String purchaseNo;
    String supplierId;
    BigDecimal unitCost;
    int quantity;
    LocalDate purchaseDate;
}
