package com.flagship.pos_inventory.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.sale.SaleLineItem;
import com.flagship.pos_inventory.sale.SaleOrder;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Value
@Builder
public class SaleResponse {

    @JsonProperty("invoice_no")
    String invoiceNo;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("employee_id")
    String employeeId;

    @JsonProperty("sale_date")
    LocalDate saleDate;

    @JsonProperty("sale_time")
    LocalTime saleTime;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

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

        static Line from(SaleLineItem line) {
            return Line.builder()
                .productCode(line.getProductCode())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .lineTotal(line.getLineTotal())
                .build();
        }
    }

    /**
     * Listing queries return headers only, so items may be empty.
     */
    public static SaleResponse from(SaleOrder sale) {
        return SaleResponse.builder()
            .invoiceNo(sale.getInvoiceNo())
            .customerId(sale.getCustomerId())
            .employeeId(sale.getEmployeeId())
            .saleDate(sale.getSaleDate())
            .saleTime(sale.getSaleTime())
            .totalAmount(sale.getTotalAmount())
            .discount(sale.getDiscount())
            .netAmount(sale.getNetAmount())
            .items(sale.getLines().stream().map(Line::from).toList())
            .build();
    }
}
