package com.flagship.pos_inventory.sale;

import com.flagship.pos_inventory.posting.LineItem;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * A sale (invoice) with its line items.
 *
 * Totals are only ever computed from the lines in {@link #create}; there is
 * no way to build a new sale with an independently chosen total.
 */
@Value
public class SaleOrder {
    String invoiceNo;
    String customerId;
    String employeeId;
    LocalDate saleDate;
    LocalTime saleTime;
    BigDecimal totalAmount;
    BigDecimal discount;
    BigDecimal netAmount;
    List<SaleLineItem> lines;

    public static SaleOrder create(String invoiceNo, String customerId, String employeeId,
                                   BigDecimal discount, List<LineItem> items,
                                   LocalDate saleDate, LocalTime saleTime) {
        SaleTotals totals = SaleTotals.compute(items, discount);
        List<SaleLineItem> lines = items.stream()
            .map(item -> new SaleLineItem(
                invoiceNo,
                item.getProductCode(),
                item.getQuantity(),
                item.getUnitPrice(),
                item.lineTotal()))
            .toList();
        return new SaleOrder(
            invoiceNo,
            customerId,
            employeeId,
            saleDate,
            saleTime,
            totals.getTotalAmount(),
            totals.getDiscount(),
            totals.getNetAmount(),
            lines
        );
    }
}
