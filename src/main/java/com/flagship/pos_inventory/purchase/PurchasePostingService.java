package com.flagship.pos_inventory.purchase;

import com.flagship.pos_inventory.config.IdGeneratorConfig;
import com.flagship.pos_inventory.inventory.InventoryLedgerService;
import com.flagship.pos_inventory.inventory.StockAdjustmentRejectedException;
import com.flagship.pos_inventory.observability.CorrelationContext;
import com.flagship.pos_inventory.observability.PostingMetrics;
import com.flagship.pos_inventory.posting.LineItem;
import com.flagship.pos_inventory.posting.LineItemValidator;
import com.flagship.pos_inventory.posting.NextIdGenerator;
import com.flagship.pos_inventory.posting.PostingError;
import com.flagship.pos_inventory.posting.PostingErrorCode;
import com.flagship.pos_inventory.posting.PostingResult;
import com.flagship.pos_inventory.posting.UnitOfWork;
import com.flagship.pos_inventory.reference.ReferenceValidator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Posts purchase orders and drives their lifecycle.
 *
 * Creating a purchase does not touch stock: goods are in transit until
 * {@link #markReceived}, which adds every line to the ledger and flips the
 * status in one unit of work. {@link #cancelPurchase} deletes a pending
 * order together with its lines.
 *
 * Receipt and cancellation lock the purchase row before reading its
 * status, so of two concurrent calls on the same order only the first one
 * acts; the second sees the committed outcome.
 */
@Service
@Slf4j
public class PurchasePostingService {

    private static final String CREATE = "create_purchase";
    private static final String RECEIVE = "receive_purchase";
    private static final String CANCEL = "cancel_purchase";

    private final ReferenceValidator referenceValidator;
    private final InventoryLedgerService ledgerService;
    private final PurchasePersistenceService persistenceService;
    private final UnitOfWork unitOfWork;
    private final NextIdGenerator purchaseNoGenerator;
    private final PostingMetrics postingMetrics;

    public PurchasePostingService(ReferenceValidator referenceValidator,
                                  InventoryLedgerService ledgerService,
                                  PurchasePersistenceService persistenceService,
                                  UnitOfWork unitOfWork,
                                  @Qualifier(IdGeneratorConfig.PURCHASE_NO_GENERATOR) NextIdGenerator purchaseNoGenerator,
                                  PostingMetrics postingMetrics) {
        this.referenceValidator = referenceValidator;
        this.ledgerService = ledgerService;
        this.persistenceService = persistenceService;
        this.unitOfWork = unitOfWork;
        this.purchaseNoGenerator = purchaseNoGenerator;
        this.postingMetrics = postingMetrics;
    }

    public PostingResult<String> createPurchase(String supplierId, List<LineItem> items) {
        return createPurchase(PurchaseRequest.of(supplierId, items));
    }

    /**
     * Creates a PENDING purchase order.
     *
     * @return the new purchase number, or the reason nothing was written
     */
    public PostingResult<String> createPurchase(PurchaseRequest request) {
        long startTime = System.currentTimeMillis();

        if (request.getIdempotencyKey() != null) {
            Optional<String> existing = persistenceService.findPurchaseNoByIdempotencyKey(request.getIdempotencyKey());
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning purchase {}", existing.get());
                postingMetrics.recordOutcome(CREATE, PostingMetrics.OUTCOME_SUCCESS);
                return PostingResult.success(existing.get());
            }
        }

        Optional<PostingError> rejection = validate(request);
        if (rejection.isPresent()) {
            return reject(CREATE, rejection.get(), startTime);
        }

        String purchaseNo = purchaseNoGenerator.nextId();
        MDC.put(CorrelationContext.PURCHASE_NO_MDC_KEY, purchaseNo);

        try {
            PurchaseOrder order = PurchaseOrder.create(
                purchaseNo, request.getSupplierId(), request.getItems(), request.getNotes(), LocalDate.now());

            unitOfWork.execute(CREATE, () -> persistenceService.save(order, request.getIdempotencyKey()));

            succeed(CREATE, startTime);
            log.info("Purchase created: supplierId={}, lines={}, total={}",
                    order.getSupplierId(), order.getLines().size(), order.getTotalAmount());
            return PostingResult.success(purchaseNo);

        } catch (DataIntegrityViolationException e) {
            if (request.getIdempotencyKey() != null) {
                Optional<String> existing = persistenceService.findPurchaseNoByIdempotencyKey(request.getIdempotencyKey());
                if (existing.isPresent()) {
                    log.info("Concurrent request with the same idempotency key already created purchase {}",
                            existing.get());
                    postingMetrics.recordOutcome(CREATE, PostingMetrics.OUTCOME_SUCCESS);
                    return PostingResult.success(existing.get());
                }
            }
            return storageFailure(CREATE, PostingErrorCode.STORAGE_FAILURE, e, startTime);

        } catch (TransientDataAccessException e) {
            return storageFailure(CREATE, PostingErrorCode.TRANSIENT_STORAGE_FAILURE, e, startTime);

        } catch (DataAccessException e) {
            return storageFailure(CREATE, PostingErrorCode.STORAGE_FAILURE, e, startTime);

        } finally {
            MDC.remove(CorrelationContext.PURCHASE_NO_MDC_KEY);
        }
    }

    /**
     * Receives the goods of a PENDING purchase: every line is added to stock
     * and the order becomes RECEIVED. Lines are applied in product-code order.
     *
     * @return the received order
     */
    public PostingResult<PurchaseOrder> markReceived(String purchaseNo) {
        return transition(RECEIVE, purchaseNo, () -> {
            Optional<PurchaseOrderEntity> locked = persistenceService.findByIdForUpdate(purchaseNo);
            if (locked.isEmpty()) {
                return PostingResult.failure(PostingError.purchaseNotFound(purchaseNo));
            }

            PurchaseOrderEntity entity = locked.get();
            PurchaseOrder order = entity.toDomain();
            if (order.getStatus() == PurchaseStatus.RECEIVED) {
                return PostingResult.failure(PostingError.of(PostingErrorCode.ALREADY_RECEIVED,
                    "Purchase " + purchaseNo + " has already been received"));
            }

            PurchaseOrder received = order.receive();
            received.getLines().stream()
                .sorted(Comparator.comparing(PurchaseLineItem::getProductCode))
                .forEach(line -> ledgerService.adjust(line.getProductCode(), line.getQuantity()));
            persistenceService.update(entity, received);

            log.info("Purchase received: lines={}, total={}", received.getLines().size(), received.getTotalAmount());
            return PostingResult.success(received);
        });
    }

    /**
     * Cancels a PENDING purchase by deleting it and its lines.
     */
    public PostingResult<Void> cancelPurchase(String purchaseNo) {
        return transition(CANCEL, purchaseNo, () -> {
            Optional<PurchaseOrderEntity> locked = persistenceService.findByIdForUpdate(purchaseNo);
            if (locked.isEmpty()) {
                return PostingResult.failure(PostingError.purchaseNotFound(purchaseNo));
            }

            PurchaseOrderEntity entity = locked.get();
            PurchaseOrder order = entity.toDomain();
            if (order.getStatus() == PurchaseStatus.RECEIVED) {
                return PostingResult.failure(PostingError.of(PostingErrorCode.CANNOT_CANCEL_RECEIVED,
                    "Purchase " + purchaseNo + " has been received and cannot be cancelled"));
            }

            PurchaseOrder cancelled = order.cancel();
            persistenceService.delete(entity);

            log.info("Purchase {} and deleted: lines={}, total={}",
                    cancelled.getStatus(), cancelled.getLines().size(), cancelled.getTotalAmount());
            return PostingResult.success(null);
        });
    }

    public Optional<PurchaseOrder> findPurchase(String purchaseNo) {
        return persistenceService.findById(purchaseNo);
    }

    public List<PurchaseOrder> findPurchasesBySupplier(String supplierId) {
        return persistenceService.findBySupplier(supplierId);
    }

    /**
     * Latest RECEIVED purchase containing the product, used as its last known cost.
     */
    public Optional<LastPurchase> findLastReceivedPurchase(String productCode) {
        return persistenceService.findLastReceived(productCode);
    }

    private <T> PostingResult<T> transition(String operation, String purchaseNo, Supplier<PostingResult<T>> work) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PURCHASE_NO_MDC_KEY, purchaseNo);

        try {
            PostingResult<T> result = unitOfWork.execute(operation, work);
            if (result.isFailure()) {
                return reject(operation, result.getError(), startTime);
            }
            succeed(operation, startTime);
            return result;

        } catch (StockAdjustmentRejectedException e) {
            // Only increments reach the ledger here, so the row must be missing
            return reject(operation, PostingError.builder()
                .code(PostingErrorCode.PRODUCT_NOT_FOUND)
                .message("No inventory record for product " + e.getProductCode())
                .productCode(e.getProductCode())
                .build(), startTime);

        } catch (TransientDataAccessException e) {
            return storageFailure(operation, PostingErrorCode.TRANSIENT_STORAGE_FAILURE, e, startTime);

        } catch (DataAccessException e) {
            return storageFailure(operation, PostingErrorCode.STORAGE_FAILURE, e, startTime);

        } finally {
            MDC.remove(CorrelationContext.PURCHASE_NO_MDC_KEY);
        }
    }

    private Optional<PostingError> validate(PurchaseRequest request) {
        if (!referenceValidator.supplierExists(request.getSupplierId())) {
            return Optional.of(PostingError.supplierNotFound(request.getSupplierId()));
        }

        Optional<PostingError> lineError = LineItemValidator.validatePurchaseLines(request.getItems());
        if (lineError.isPresent()) {
            return lineError;
        }

        return referenceValidator.findFirstMissingProduct(
                request.getItems().stream().map(LineItem::getProductCode).toList())
            .map(PostingError::productNotFound);
    }

    private void succeed(String operation, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        postingMetrics.recordOutcome(operation, PostingMetrics.OUTCOME_SUCCESS);
        postingMetrics.recordLatency(operation, duration);
        log.debug("{} succeeded in {}ms", operation, duration);
    }

    private <T> PostingResult<T> reject(String operation, PostingError error, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        postingMetrics.recordOutcome(operation, error.getCode().name());
        postingMetrics.recordLatency(operation, duration);
        log.warn("{} rejected: code={}, message={}, duration={}ms",
                operation, error.getCode(), error.getMessage(), duration);
        return PostingResult.failure(error);
    }

    private <T> PostingResult<T> storageFailure(String operation, PostingErrorCode code,
                                                DataAccessException e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        postingMetrics.recordOutcome(operation, code.name());
        postingMetrics.recordLatency(operation, duration);
        log.error("{} failed and was rolled back: code={}, error={}, duration={}ms",
                operation, code, e.getMostSpecificCause().getMessage(), duration, e);
        return PostingResult.failure(PostingError.of(code, code == PostingErrorCode.TRANSIENT_STORAGE_FAILURE
            ? "Purchase could not be stored right now, retry later"
            : "Purchase could not be stored"));
    }
}
