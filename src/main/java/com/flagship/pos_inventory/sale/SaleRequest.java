package com.flagship.pos_inventory.sale;

import com.flagship.pos_inventory.posting.LineItem;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input of {@link SalePostingService#createSale(SaleRequest)}: the cart as a
 * whole, validated before the atomic phase starts.
 *
 * idempotencyKey is optional; when present it is stored on the sale header
 * and a repeated key yields the sale created first.
 */
@Value
public class SaleRequest {
    String customerId;
    String employeeId;
    BigDecimal discount;
    List<LineItem> items;
    String idempotencyKey;

    public static SaleRequest of(String customerId, String employeeId, BigDecimal discount, List<LineItem> items) {
        return new SaleRequest(customerId, employeeId, discount, items, null);
    }

    public int requestedQuantity(String productCode) {
        return items.stream()
            .filter(item -> item.getProductCode().equals(productCode))
            .mapToInt(LineItem::getQuantity)
            .sum();
    }
}
