package com.flagship.pos_inventory.purchase;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for purchase_orders.
 *
 * No setters: entities are created with {@link #fromDomain} and only the
 * status changes afterwards, through {@link #updateFromDomain}. The
 * idempotency key is a persistence concern and is not part of the domain object.
 *
 * Removing the entity removes its lines first (cascade), which is how a
 * cancelled purchase disappears.
 */
@Entity
@Table(name = "purchase_orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PurchaseOrderEntity {

    @Id
    @Column(name = "purchase_no", nullable = false, updatable = false)
    private String purchaseNo;

    @Column(name = "supplier_id", nullable = false, updatable = false)
    private String supplierId;

    @Column(name = "purchase_date", nullable = false, updatable = false)
    private LocalDate purchaseDate;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PurchaseStatus status;

    @Column(length = 500, updatable = false)
    private String notes;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @OneToMany(mappedBy = "purchaseOrder", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNo")
    private List<PurchaseLineItemEntity> lines = new ArrayList<>();

    static PurchaseOrderEntity fromDomain(PurchaseOrder order, String idempotencyKey) {
        PurchaseOrderEntity entity = new PurchaseOrderEntity();
        entity.purchaseNo = order.getPurchaseNo();
        entity.supplierId = order.getSupplierId();
        entity.purchaseDate = order.getPurchaseDate();
        entity.totalAmount = order.getTotalAmount();
        entity.status = order.getStatus();
        entity.notes = order.getNotes();
        entity.idempotencyKey = idempotencyKey;

        List<PurchaseLineItem> domainLines = order.getLines();
        for (int i = 0; i < domainLines.size(); i++) {
            entity.lines.add(PurchaseLineItemEntity.fromDomain(entity, domainLines.get(i), i + 1));
        }
        return entity;
    }

    public PurchaseOrder toDomain() {
        return new PurchaseOrder(
            purchaseNo,
            supplierId,
            purchaseDate,
            totalAmount,
            status,
            notes,
            lines.stream().map(PurchaseLineItemEntity::toDomain).toList()
        );
    }

    /**
     * Only the status is mutable once the order is stored.
     */
    void updateFromDomain(PurchaseOrder order) {
        if (!purchaseNo.equals(order.getPurchaseNo())) {
            throw new IllegalArgumentException(
                "Cannot update purchase " + purchaseNo + " from purchase " + order.getPurchaseNo());
        }
        this.status = order.getStatus();
    }
}
