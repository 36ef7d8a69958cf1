package com.flagship.pos_inventory.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.purchase.LastPurchase;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class LastPurchaseResponse {

    @JsonProperty("product_code")
    String productCode;

    @JsonProperty("purchase_no")
    String purchaseNo;

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("purchase_date")
    LocalDate purchaseDate;

    public static LastPurchaseResponse from(LastPurchase lastPurchase) {
        return LastPurchaseResponse.builder()
            .productCode(lastPurchase.getProductCode())
            .purchaseNo(lastPurchase.getPurchaseNo())
            .supplierId(lastPurchase.getSupplierId())
            .unitCost(lastPurchase.getUnitCost())
            .quantity(lastPurchase.getQuantity())
            .purchaseDate(lastPurchase.getPurchaseDate())
            .build();
    }
}
