package com.flagship.pos_inventory.purchase;

import com.flagship.pos_inventory.posting.LineItem;
import lombok.Value;

import java.util.List;

/**
 * Input of {@link PurchasePostingService#createPurchase(PurchaseRequest)}.
 * notes and idempotencyKey are optional.
 */
@Value
public class PurchaseRequest {
    String supplierId;
    List<LineItem> items;
    String notes;
    String idempotencyKey;

    public static PurchaseRequest of(String supplierId, List<LineItem> items) {
        return new PurchaseRequest(supplierId, items, null, null);
    }
}
