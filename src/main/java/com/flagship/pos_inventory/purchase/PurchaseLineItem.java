package com.flagship.pos_inventory.purchase;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class PurchaseLineItem {
    String purchaseNo;
    String productCode;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal lineTotal;
}
