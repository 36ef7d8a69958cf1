package com.flagship.pos_inventory.sale;

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
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Posts sales: validates the cart, then writes the sale and deducts stock
 * as one unit of work.
 *
 * Validation (first failure wins, nothing is written):
 * 1. cart not empty, every line well formed
 * 2. discount not negative
 * 3. customer exists
 * 4. employee exists
 * 5. every product exists
 * 6. stock snapshot covers every line (first short line is reported)
 *
 * The snapshot in step 6 only gives the till a quick answer. The ledger's
 * conditional update inside the unit of work is what actually keeps stock
 * from going negative; if it refuses a line, the whole sale rolls back and
 * the caller gets INSUFFICIENT_STOCK for that product.
 *
 * Ledger deductions are applied in product-code order so that two carts
 * sharing products always lock inventory rows in the same order.
 */
@Service
@Slf4j
public class SalePostingService {

    private static final String OPERATION = "create_sale";

    private final ReferenceValidator referenceValidator;
    private final InventoryLedgerService ledgerService;
    private final SaleRepository saleRepository;
    private final UnitOfWork unitOfWork;
    private final NextIdGenerator invoiceNoGenerator;
    private final PostingMetrics postingMetrics;

    public SalePostingService(ReferenceValidator referenceValidator,
                              InventoryLedgerService ledgerService,
                              SaleRepository saleRepository,
                              UnitOfWork unitOfWork,
                              @Qualifier(IdGeneratorConfig.INVOICE_NO_GENERATOR) NextIdGenerator invoiceNoGenerator,
                              PostingMetrics postingMetrics) {
        this.referenceValidator = referenceValidator;
        this.ledgerService = ledgerService;
        this.saleRepository = saleRepository;
        this.unitOfWork = unitOfWork;
        this.invoiceNoGenerator = invoiceNoGenerator;
        this.postingMetrics = postingMetrics;
    }

    public PostingResult<String> createSale(String customerId, String employeeId,
                                            BigDecimal discount, List<LineItem> items) {
        return createSale(SaleRequest.of(customerId, employeeId, discount, items));
    }

    /**
     * Creates a sale.
     *
     * @return the new invoice number, or the reason nothing was written
     */
    public PostingResult<String> createSale(SaleRequest request) {
        long startTime = System.currentTimeMillis();

        if (request.getIdempotencyKey() != null) {
            Optional<String> existing = saleRepository.findInvoiceNoByIdempotencyKey(request.getIdempotencyKey());
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning sale {}", existing.get());
                postingMetrics.recordOutcome(OPERATION, PostingMetrics.OUTCOME_SUCCESS);
                return PostingResult.success(existing.get());
            }
        }

        Optional<PostingError> rejection = validate(request);
        if (rejection.isPresent()) {
            return reject(rejection.get(), startTime);
        }

        String invoiceNo = invoiceNoGenerator.nextId();
        MDC.put(CorrelationContext.INVOICE_NO_MDC_KEY, invoiceNo);

        try {
            SaleOrder sale = SaleOrder.create(
                invoiceNo,
                request.getCustomerId(),
                request.getEmployeeId(),
                request.getDiscount(),
                request.getItems(),
                LocalDate.now(),
                LocalTime.now().truncatedTo(ChronoUnit.SECONDS)
            );

            unitOfWork.run(OPERATION, () -> {
                saleRepository.insert(sale, request.getIdempotencyKey());
                sale.getLines().stream()
                    .sorted(Comparator.comparing(SaleLineItem::getProductCode))
                    .forEach(line -> ledgerService.adjust(line.getProductCode(), -line.getQuantity()));
            });

            long duration = System.currentTimeMillis() - startTime;
            postingMetrics.recordOutcome(OPERATION, PostingMetrics.OUTCOME_SUCCESS);
            postingMetrics.recordLatency(OPERATION, duration);
            log.info("Sale posted: lines={}, total={}, discount={}, net={}, duration={}ms",
                    sale.getLines().size(), sale.getTotalAmount(), sale.getDiscount(),
                    sale.getNetAmount(), duration);

            return PostingResult.success(invoiceNo);

        } catch (StockAdjustmentRejectedException e) {
            // Stock moved between the snapshot and the deduction
            String productCode = e.getProductCode();
            return reject(PostingError.insufficientStock(
                productCode,
                request.requestedQuantity(productCode),
                ledgerService.availableStock(productCode)), startTime);

        } catch (DuplicateKeyException e) {
            if (request.getIdempotencyKey() != null) {
                Optional<String> existing = saleRepository.findInvoiceNoByIdempotencyKey(request.getIdempotencyKey());
                if (existing.isPresent()) {
                    log.info("Concurrent request with the same idempotency key already posted sale {}",
                            existing.get());
                    postingMetrics.recordOutcome(OPERATION, PostingMetrics.OUTCOME_SUCCESS);
                    return PostingResult.success(existing.get());
                }
            }
            return storageFailure(PostingErrorCode.STORAGE_FAILURE, e, startTime);

        } catch (TransientDataAccessException e) {
            return storageFailure(PostingErrorCode.TRANSIENT_STORAGE_FAILURE, e, startTime);

        } catch (DataAccessException e) {
            return storageFailure(PostingErrorCode.STORAGE_FAILURE, e, startTime);

        } finally {
            MDC.remove(CorrelationContext.INVOICE_NO_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Optional<SaleOrder> findSale(String invoiceNo) {
        return saleRepository.findByInvoiceNo(invoiceNo);
    }

    @Transactional(readOnly = true)
    public List<SaleOrder> findRecentSales(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return saleRepository.findRecent(limit);
    }

    @Transactional(readOnly = true)
    public List<SaleOrder> findSalesByCustomer(String customerId) {
        return saleRepository.findByCustomer(customerId);
    }

    @Transactional(readOnly = true)
    public List<SaleOrder> findSalesByEmployee(String employeeId) {
        return saleRepository.findByEmployee(employeeId);
    }

    @Transactional(readOnly = true)
    public List<SaleOrder> findSalesByDateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Both start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        return saleRepository.findByDateRange(start, end);
    }

    private Optional<PostingError> validate(SaleRequest request) {
        List<LineItem> items = request.getItems();

        Optional<PostingError> lineError = LineItemValidator.validateSaleLines(items);
        if (lineError.isPresent()) {
            return lineError;
        }

        if (request.getDiscount() != null && request.getDiscount().compareTo(BigDecimal.ZERO) < 0) {
            return Optional.of(PostingError.of(PostingErrorCode.INVALID_DISCOUNT,
                "Discount cannot be negative: " + request.getDiscount()));
        }
        if (request.getDiscount() != null && request.getDiscount().compareTo(LineItemValidator.MAX_AMOUNT) > 0) {
            return Optional.of(PostingError.of(PostingErrorCode.INVALID_DISCOUNT,
                "Discount cannot exceed " + LineItemValidator.MAX_AMOUNT + ": " + request.getDiscount()));
        }

        if (!referenceValidator.customerExists(request.getCustomerId())) {
            return Optional.of(PostingError.customerNotFound(request.getCustomerId()));
        }
        if (!referenceValidator.employeeExists(request.getEmployeeId())) {
            return Optional.of(PostingError.employeeNotFound(request.getEmployeeId()));
        }

        Optional<String> missingProduct = referenceValidator.findFirstMissingProduct(
            items.stream().map(LineItem::getProductCode).toList());
        if (missingProduct.isPresent()) {
            return Optional.of(PostingError.productNotFound(missingProduct.get()));
        }

        for (LineItem item : items) {
            int available = ledgerService.availableStock(item.getProductCode());
            if (item.getQuantity() > available) {
                return Optional.of(PostingError.insufficientStock(item.getProductCode(), item.getQuantity(), available));
            }
        }
        return Optional.empty();
    }

    private PostingResult<String> reject(PostingError error, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        postingMetrics.recordOutcome(OPERATION, error.getCode().name());
        postingMetrics.recordLatency(OPERATION, duration);
        log.warn("Sale rejected: code={}, message={}, duration={}ms", error.getCode(), error.getMessage(), duration);
        return PostingResult.failure(error);
    }

    private PostingResult<String> storageFailure(PostingErrorCode code, DataAccessException e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        postingMetrics.recordOutcome(OPERATION, code.name());
        postingMetrics.recordLatency(OPERATION, duration);
        log.error("Sale posting failed and was rolled back: code={}, error={}, duration={}ms",
                code, e.getMostSpecificCause().getMessage(), duration, e);
        return PostingResult.failure(PostingError.of(code, code == PostingErrorCode.TRANSIENT_STORAGE_FAILURE
            ? "Sale could not be stored right now, retry later"
            : "Sale could not be stored"));
    }
}
