package com.flagship.pos_inventory.purchase;

import com.flagship.pos_inventory.posting.LineItem;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

/**
 * Purchase order domain object.
 *
 * Transitions return a new instance and reject anything the state machine
 * does not allow; only PENDING orders can move.
 */
@Value
public class PurchaseOrder {
    String purchaseNo;
    String supplierId;
    LocalDate purchaseDate;
    BigDecimal totalAmount;
    PurchaseStatus status;
    String notes;
    List<PurchaseLineItem> lines;

    /**
     * Creates a new order in PENDING status with its total derived from the lines.
     */
    public static PurchaseOrder create(String purchaseNo, String supplierId, List<LineItem> items,
                                       String notes, LocalDate purchaseDate) {
        List<PurchaseLineItem> lines = items.stream()
            .map(item -> new PurchaseLineItem(
                purchaseNo,
                item.getProductCode(),
                item.getQuantity(),
                item.getUnitPrice(),
                item.lineTotal()))
            .toList();
        BigDecimal total = lines.stream()
            .map(PurchaseLineItem::getLineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
        return new PurchaseOrder(purchaseNo, supplierId, purchaseDate, total, PurchaseStatus.PENDING, notes, lines);
    }

    /**
     * @throws IllegalStateException unless the order is PENDING
     */
    public PurchaseOrder receive() {
        if (status != PurchaseStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot receive purchase %s in %s status. Only PENDING purchases can be received.",
                    purchaseNo, status));
        }
        return withStatus(PurchaseStatus.RECEIVED);
    }

    /**
     * @throws IllegalStateException unless the order is PENDING
     */
    public PurchaseOrder cancel() {
        if (status != PurchaseStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot cancel purchase %s in %s status. Only PENDING purchases can be cancelled.",
                    purchaseNo, status));
        }
        return withStatus(PurchaseStatus.CANCELLED);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(PurchaseStatus target) {
        return switch (status) {
            case PENDING -> target == PurchaseStatus.RECEIVED || target == PurchaseStatus.CANCELLED;
            case RECEIVED, CANCELLED -> false;
        };
    }

    private PurchaseOrder withStatus(PurchaseStatus newStatus) {
        return new PurchaseOrder(purchaseNo, supplierId, purchaseDate, totalAmount, newStatus, notes, lines);
    }
}
