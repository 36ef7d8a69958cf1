package com.flagship.pos_inventory.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrderEntity, String> {

    /**
     * Loads the order with SELECT ... FOR UPDATE. Concurrent receipts or
     * cancellations of the same order queue behind the first one and then
     * see its committed status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseOrderEntity p WHERE p.purchaseNo = :purchaseNo")
    Optional<PurchaseOrderEntity> findByIdForUpdate(@Param("purchaseNo") String purchaseNo);

    Optional<PurchaseOrderEntity> findByIdempotencyKey(String idempotencyKey);

    List<PurchaseOrderEntity> findBySupplierIdOrderByPurchaseDateDescPurchaseNoDesc(String supplierId);

    @Query("SELECT l FROM PurchaseLineItemEntity l JOIN FETCH l.purchaseOrder p " +
           "WHERE l.id.productCode = :productCode AND p.status = :status " +
           "ORDER BY p.purchaseDate DESC, p.purchaseNo DESC")
    List<PurchaseLineItemEntity> findLinesByProductAndStatus(@Param("productCode") String productCode,
                                                             @Param("status") PurchaseStatus status,
                                                             Pageable pageable);
}
