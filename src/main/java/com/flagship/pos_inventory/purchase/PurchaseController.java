package com.flagship.pos_inventory.purchase;

import com.flagship.pos_inventory.api.LineItemRequest;
import com.flagship.pos_inventory.api.PostingResponses;
import com.flagship.pos_inventory.idempotency.IdempotencyScope;
import com.flagship.pos_inventory.idempotency.IdempotencyService;
import com.flagship.pos_inventory.posting.PostingResult;
import com.flagship.pos_inventory.purchase.dto.CreatePurchaseRequest;
import com.flagship.pos_inventory.purchase.dto.LastPurchaseResponse;
import com.flagship.pos_inventory.purchase.dto.PurchaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Purchase order endpoints: create, receive, cancel and lookups.
 */
@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PurchasePostingService purchasePostingService;
    private final IdempotencyService idempotencyService;

    @PostMapping
    public ResponseEntity<?> createPurchase(
            @Valid @RequestBody CreatePurchaseRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received purchase request: supplierId={}, items={}, idempotencyKey={}",
                request.getSupplierId(), request.getItems().size(), idempotencyKey);

        if (idempotencyKey != null) {
            Optional<String> existing = idempotencyService.findExisting(IdempotencyScope.PURCHASE, idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning purchase {}", existing.get());
                return ResponseEntity.ok(loadPurchase(existing.get()));
            }
        }

        PostingResult<String> result = purchasePostingService.createPurchase(new PurchaseRequest(
            request.getSupplierId(),
            request.getItems().stream().map(LineItemRequest::toLineItem).toList(),
            request.getNotes(),
            idempotencyKey
        ));
        if (result.isFailure()) {
            return PostingResponses.failure(result.getError());
        }

        String purchaseNo = result.getValue();
        if (idempotencyKey != null) {
            idempotencyService.remember(IdempotencyScope.PURCHASE, idempotencyKey, purchaseNo);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(loadPurchase(purchaseNo));
    }

    @PostMapping("/{purchaseNo}/receive")
    public ResponseEntity<?> receivePurchase(@PathVariable("purchaseNo") String purchaseNo) {
        PostingResult<PurchaseOrder> result = purchasePostingService.markReceived(purchaseNo);
        if (result.isFailure()) {
            return PostingResponses.failure(result.getError());
        }
        return ResponseEntity.ok(PurchaseResponse.from(result.getValue()));
    }

    @DeleteMapping("/{purchaseNo}")
    public ResponseEntity<?> cancelPurchase(@PathVariable("purchaseNo") String purchaseNo) {
        PostingResult<Void> result = purchasePostingService.cancelPurchase(purchaseNo);
        if (result.isFailure()) {
            return PostingResponses.failure(result.getError());
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{purchaseNo}")
    public ResponseEntity<PurchaseResponse> getPurchase(@PathVariable("purchaseNo") String purchaseNo) {
        return purchasePostingService.findPurchase(purchaseNo)
            .map(order -> ResponseEntity.ok(PurchaseResponse.from(order)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<PurchaseResponse> listBySupplier(@RequestParam("supplier_id") String supplierId) {
        return purchasePostingService.findPurchasesBySupplier(supplierId).stream()
            .map(PurchaseResponse::from)
            .toList();
    }

    @GetMapping("/last-received")
    public ResponseEntity<LastPurchaseResponse> lastReceived(@RequestParam("product_code") String productCode) {
        return purchasePostingService.findLastReceivedPurchase(productCode)
            .map(last -> ResponseEntity.ok(LastPurchaseResponse.from(last)))
            .orElse(ResponseEntity.notFound().build());
    }

    private PurchaseResponse loadPurchase(String purchaseNo) {
        return purchasePostingService.findPurchase(purchaseNo)
            .map(PurchaseResponse::from)
            .orElseThrow(() -> new IllegalStateException(
                "Purchase " + purchaseNo + " was created but cannot be read back"));
    }
}
