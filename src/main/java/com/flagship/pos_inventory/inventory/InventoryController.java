package com.flagship.pos_inventory.inventory;

import com.flagship.pos_inventory.inventory.dto.InventoryResponse;
import com.flagship.pos_inventory.inventory.dto.LowStockResponse;
import com.flagship.pos_inventory.inventory.dto.StockAdjustmentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Stock lookups and manual corrections.
 *
 * A rejected adjustment (would go negative, or no inventory record)
 * surfaces as StockAdjustmentRejectedException and is rendered as 409.
 */
@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
@Slf4j
public class InventoryController {

    private final InventoryLedgerService ledgerService;

    @GetMapping("/low-stock")
    public List<LowStockResponse> lowStock() {
        return ledgerService.findLowStock().stream()
            .map(LowStockResponse::from)
            .toList();
    }

    @GetMapping("/{productCode}")
    public ResponseEntity<InventoryResponse> getStock(@PathVariable("productCode") String productCode) {
        return ledgerService.findRecord(productCode)
            .map(record -> ResponseEntity.ok(InventoryResponse.from(record)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{productCode}/adjustments")
    public InventoryResponse adjustStock(@PathVariable("productCode") String productCode,
                                         @Valid @RequestBody StockAdjustmentRequest request) {
        log.info("Received manual stock adjustment: productCode={}, delta={}", productCode, request.getDelta());
        InventoryRecord record = ledgerService.applyManualAdjustment(productCode, request.getDelta(), request.getReason());
        return InventoryResponse.from(record);
    }
}
