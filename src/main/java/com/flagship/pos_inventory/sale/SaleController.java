package com.flagship.pos_inventory.sale;

import com.flagship.pos_inventory.api.LineItemRequest;
import com.flagship.pos_inventory.api.PostingResponses;
import com.flagship.pos_inventory.idempotency.IdempotencyScope;
import com.flagship.pos_inventory.idempotency.IdempotencyService;
import com.flagship.pos_inventory.posting.PostingResult;
import com.flagship.pos_inventory.sale.dto.CreateSaleRequest;
import com.flagship.pos_inventory.sale.dto.SaleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Sale endpoints used by the till.
 *
 * POST is idempotent when an Idempotency-Key header is sent: a repeated
 * key returns the sale created the first time with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
@Slf4j
public class SaleController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final int DEFAULT_LIMIT = 20;

    private final SalePostingService salePostingService;
    private final IdempotencyService idempotencyService;

    @PostMapping
    public ResponseEntity<?> createSale(
            @Valid @RequestBody CreateSaleRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received sale request: customerId={}, employeeId={}, items={}, idempotencyKey={}",
                request.getCustomerId(), request.getEmployeeId(), request.getItems().size(), idempotencyKey);

        if (idempotencyKey != null) {
            Optional<String> existing = idempotencyService.findExisting(IdempotencyScope.SALE, idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning sale {}", existing.get());
                return ResponseEntity.ok(loadSale(existing.get()));
            }
        }

        SaleRequest saleRequest = new SaleRequest(
            request.getCustomerId(),
            request.getEmployeeId(),
            request.getDiscount(),
            request.getItems().stream().map(LineItemRequest::toLineItem).toList(),
            idempotencyKey
        );

        PostingResult<String> result = salePostingService.createSale(saleRequest);
        if (result.isFailure()) {
            return PostingResponses.failure(result.getError());
        }

        String invoiceNo = result.getValue();
        if (idempotencyKey != null) {
            idempotencyService.remember(IdempotencyScope.SALE, idempotencyKey, invoiceNo);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(loadSale(invoiceNo));
    }

    @GetMapping("/{invoiceNo}")
    public ResponseEntity<SaleResponse> getSale(@PathVariable("invoiceNo") String invoiceNo) {
        return salePostingService.findSale(invoiceNo)
            .map(sale -> ResponseEntity.ok(SaleResponse.from(sale)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Lists sale headers. Filters are exclusive: customer, then employee,
     * then date range, otherwise the most recent sales.
     */
    @GetMapping
    public List<SaleResponse> listSales(
            @RequestParam(value = "customer_id", required = false) String customerId,
            @RequestParam(value = "employee_id", required = false) String employeeId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "limit", required = false) Integer limit) {

        List<SaleOrder> sales;
        if (customerId != null) {
            sales = salePostingService.findSalesByCustomer(customerId);
        } else if (employeeId != null) {
            sales = salePostingService.findSalesByEmployee(employeeId);
        } else if (from != null || to != null) {
            sales = salePostingService.findSalesByDateRange(from, to);
        } else {
            sales = salePostingService.findRecentSales(limit != null ? limit : DEFAULT_LIMIT);
        }
        return sales.stream().map(SaleResponse::from).toList();
    }

    private SaleResponse loadSale(String invoiceNo) {
        return salePostingService.findSale(invoiceNo)
            .map(SaleResponse::from)
            .orElseThrow(() -> new IllegalStateException("Sale " + invoiceNo + " was posted but cannot be read back"));
    }
}
