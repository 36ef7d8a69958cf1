package com.flagship.pos_inventory.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.purchase.PurchaseLineItem;
import com.flagship.pos_inventory.purchase.PurchaseOrder;
import com.flagship.pos_inventory.purchase.PurchaseStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("purchase_no")
    String purchaseNo;

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("purchase_date")
    LocalDate purchaseDate;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("status")
    PurchaseStatus status;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("items")
    List<Line> items;

    @Value
    @Builder
    public static class Line {

        @JsonProperty("product_code")
        String productCode;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @JsonProperty("line_total")
        BigDecimal lineTotal;

        static Line from(PurchaseLineItem line) {
            return Line.builder()
                .productCode(line.getProductCode())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .lineTotal(line.getLineTotal())
                .build();
        }
    }

    public static PurchaseResponse from(PurchaseOrder order) {
        return PurchaseResponse.builder()
            .purchaseNo(order.getPurchaseNo())
            .supplierId(order.getSupplierId())
            .purchaseDate(order.getPurchaseDate())
            .totalAmount(order.getTotalAmount())
            .status(order.getStatus())
            .notes(order.getNotes())
            .items(order.getLines().stream().map(Line::from).toList())
            .build();
    }
}
