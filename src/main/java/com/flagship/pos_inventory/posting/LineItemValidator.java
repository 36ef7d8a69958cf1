package com.flagship.pos_inventory.posting;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shape checks shared by the sale and purchase engines.
 *
 * Runs before any reference lookup, so a malformed cart is rejected
 * without touching the store.
 */
public final class LineItemValidator {

    /**
     * Largest amount a NUMERIC(10,2) column holds. Applies to unit prices,
     * line totals and document totals.
     */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999.99");

    private LineItemValidator() {
        // Utility class
    }

    /**
     * Sale lines must move at least one unit.
     */
    public static Optional<PostingError> validateSaleLines(List<LineItem> items) {
        return validate(items, 1);
    }

    /**
     * Purchase lines may carry a zero quantity (placeholder lines on an order).
     */
    public static Optional<PostingError> validatePurchaseLines(List<LineItem> items) {
        return validate(items, 0);
    }

    private static Optional<PostingError> validate(List<LineItem> items, int minimumQuantity) {
        if (items == null || items.isEmpty()) {
            return Optional.of(PostingError.emptyCart());
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            LineItem item = items.get(i);
            if (item == null) {
                return invalid(i, "line item is missing");
            }
            if (item.getProductCode() == null || item.getProductCode().isBlank()) {
                return invalid(i, "product code is required");
            }
            if (item.getQuantity() < minimumQuantity) {
                return invalid(i, String.format("quantity %d for %s must be at least %d",
                    item.getQuantity(), item.getProductCode(), minimumQuantity));
            }
            if (item.getUnitPrice() == null || item.getUnitPrice().compareTo(BigDecimal.ZERO) < 0) {
                return invalid(i, "unit price for " + item.getProductCode() + " must be zero or positive");
            }
            if (item.getUnitPrice().compareTo(MAX_AMOUNT) > 0) {
                return invalid(i, "unit price for " + item.getProductCode() + " exceeds " + MAX_AMOUNT);
            }
            if (item.lineTotal().compareTo(MAX_AMOUNT) > 0) {
                return invalid(i, "line total for " + item.getProductCode() + " exceeds " + MAX_AMOUNT);
            }
            if (!seen.add(item.getProductCode())) {
                return invalid(i, "product " + item.getProductCode() + " appears more than once");
            }
        }

        BigDecimal total = items.stream()
            .map(LineItem::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.compareTo(MAX_AMOUNT) > 0) {
            return Optional.of(PostingError.of(PostingErrorCode.INVALID_LINE_ITEM,
                "Order total " + total + " exceeds " + MAX_AMOUNT));
        }
        return Optional.empty();
    }

    private static Optional<PostingError> invalid(int index, String reason) {
        return Optional.of(PostingError.of(PostingErrorCode.INVALID_LINE_ITEM,
            "Invalid line item #" + (index + 1) + ": " + reason));
    }
}
