package com.flagship.pos_inventory.sale;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A persisted sale line. Written once together with its sale, never updated.
 */
@Value
public class SaleLineItem {
    String invoiceNo;
    String productCode;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal lineTotal;
}
