package com.flagship.pos_inventory.purchase;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JPA entity for one purchase line. Lines are written and deleted only
 * through their {@link PurchaseOrderEntity}.
 */
@Entity
@Table(name = "purchase_line_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseLineItemEntity {

    @EmbeddedId
    private PurchaseLineItemId id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "purchase_no", insertable = false, updatable = false)
    private PurchaseOrderEntity purchaseOrder;

    @Column(name = "line_no", nullable = false, updatable = false)
    private int lineNo;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal unitPrice;

    @Column(name = "line_total", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal lineTotal;

    static PurchaseLineItemEntity fromDomain(PurchaseOrderEntity order, PurchaseLineItem line, int lineNo) {
        return new PurchaseLineItemEntity(
            new PurchaseLineItemId(order.getPurchaseNo(), line.getProductCode()),
            order,
            lineNo,
            line.getQuantity(),
            line.getUnitPrice(),
            line.getLineTotal()
        );
    }

    public String getProductCode() {
        return id.getProductCode();
    }

    public PurchaseLineItem toDomain() {
        return new PurchaseLineItem(id.getPurchaseNo(), id.getProductCode(), quantity, unitPrice, lineTotal);
    }
}
