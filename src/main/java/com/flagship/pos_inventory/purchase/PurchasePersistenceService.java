package com.flagship.pos_inventory.purchase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Bridges the purchase domain object and its JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchasePersistenceService {

    private final PurchaseOrderRepository purchaseOrderRepository;

    /**
     * Inserts the order with its lines. Flushes immediately so constraint
     * violations surface here rather than at commit.
     */
    @Transactional
    public PurchaseOrderEntity save(PurchaseOrder order, String idempotencyKey) {
        PurchaseOrderEntity entity = PurchaseOrderEntity.fromDomain(order, idempotencyKey);
        PurchaseOrderEntity saved = purchaseOrderRepository.saveAndFlush(entity);
        log.debug("Saved purchase {} with {} lines", saved.getPurchaseNo(), saved.getLines().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<PurchaseOrder> findById(String purchaseNo) {
        return purchaseOrderRepository.findById(purchaseNo)
            .map(PurchaseOrderEntity::toDomain);
    }

    /**
     * Must be called inside the caller's transaction; the row lock is held until it ends.
     */
    @Transactional
    public Optional<PurchaseOrderEntity> findByIdForUpdate(String purchaseNo) {
        return purchaseOrderRepository.findByIdForUpdate(purchaseNo);
    }

    @Transactional(readOnly = true)
    public Optional<String> findPurchaseNoByIdempotencyKey(String idempotencyKey) {
        return purchaseOrderRepository.findByIdempotencyKey(idempotencyKey)
            .map(PurchaseOrderEntity::getPurchaseNo);
    }

    @Transactional(readOnly = true)
    public List<PurchaseOrder> findBySupplier(String supplierId) {
        return purchaseOrderRepository.findBySupplierIdOrderByPurchaseDateDescPurchaseNoDesc(supplierId)
            .stream()
            .map(PurchaseOrderEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<LastPurchase> findLastReceived(String productCode) {
        return purchaseOrderRepository
            .findLinesByProductAndStatus(productCode, PurchaseStatus.RECEIVED, PageRequest.of(0, 1))
            .stream()
            .findFirst()
            .map(line -> new LastPurchase(
                line.getProductCode(),
                line.getPurchaseOrder().getPurchaseNo(),
                line.getPurchaseOrder().getSupplierId(),
                line.getUnitPrice(),
                line.getQuantity(),
                line.getPurchaseOrder().getPurchaseDate()
            ));
    }

    @Transactional
    public PurchaseOrderEntity update(PurchaseOrderEntity entity, PurchaseOrder order) {
        entity.updateFromDomain(order);
        PurchaseOrderEntity updated = purchaseOrderRepository.saveAndFlush(entity);
        log.debug("Updated purchase {} to {}", updated.getPurchaseNo(), updated.getStatus());
        return updated;
    }

    @Transactional
    public void delete(PurchaseOrderEntity entity) {
        purchaseOrderRepository.delete(entity);
        purchaseOrderRepository.flush();
        log.debug("Deleted purchase {} and its lines", entity.getPurchaseNo());
    }
}
