package com.flagship.pos_inventory.sale;

import com.flagship.pos_inventory.posting.LineItem;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Header amounts of a sale, derived from its lines.
 *
 * net = max(total - discount, 0). A discount larger than the total is not
 * rejected; the net amount is clamped at zero.
 */
@Value
public class SaleTotals {
    BigDecimal totalAmount;
    BigDecimal discount;
    BigDecimal netAmount;

    public static SaleTotals compute(List<LineItem> items, BigDecimal discount) {
        BigDecimal total = items.stream()
            .map(LineItem::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
        BigDecimal effectiveDiscount = (discount == null ? BigDecimal.ZERO : discount)
            .setScale(2, RoundingMode.HALF_UP);
        BigDecimal net = total.subtract(effectiveDiscount).max(BigDecimal.ZERO.setScale(2));
        return new SaleTotals(total, effectiveDiscount, net);
    }
}
