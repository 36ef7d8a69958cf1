package com.flagship.pos_inventory.purchase;

import com.flagship.pos_inventory.inventory.InventoryLedgerService;
import com.flagship.pos_inventory.observability.PostingMetrics;
import com.flagship.pos_inventory.posting.LineItem;
import com.flagship.pos_inventory.posting.PostingErrorCode;
import com.flagship.pos_inventory.posting.PostingResult;
import com.flagship.pos_inventory.posting.UnitOfWork;
import com.flagship.pos_inventory.reference.ReferenceValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PurchasePostingServiceMockTest {

    private ReferenceValidator referenceValidator;
    private PurchasePersistenceService persistenceService;
    private UnitOfWork unitOfWork;
    private PurchasePostingService purchasePostingService;

    @BeforeEach
    void setUp() {
        referenceValidator = mock(ReferenceValidator.class);
        persistenceService = mock(PurchasePersistenceService.class);
        unitOfWork = mock(UnitOfWork.class);

        when(referenceValidator.supplierExists("S1")).thenReturn(true);
        when(referenceValidator.findFirstMissingProduct(any())).thenReturn(Optional.empty());
        when(persistenceService.findPurchaseNoByIdempotencyKey(anyString())).thenReturn(Optional.empty());

        purchasePostingService = new PurchasePostingService(referenceValidator, mock(InventoryLedgerService.class),
            persistenceService, unitOfWork, () -> "PUR042", new PostingMetrics(new SimpleMeterRegistry()));
    }

    private PurchaseRequest request(String supplierId, String idempotencyKey) {
        return new PurchaseRequest(supplierId, List.of(LineItem.of("P1", 3, BigDecimal.ONE)), null, idempotencyKey);
    }

    @Test
    @DisplayName("Known idempotency key returns the stored purchase even if the supplier is gone")
    void testKnownKeySkipsValidation() {
        when(persistenceService.findPurchaseNoByIdempotencyKey("po-1")).thenReturn(Optional.of("PUR001"));

        PostingResult<String> result = purchasePostingService.createPurchase(request("S-GONE", "po-1"));

        assertEquals("PUR001", result.orElseThrow());
        verifyNoInteractions(referenceValidator, unitOfWork);
    }

    @Test
    @DisplayName("Storage failure does not leak database details to the caller")
    void testStorageFailureMessageIsGeneric() {
        when(unitOfWork.execute(anyString(), any())).thenThrow(new DataIntegrityViolationException(
            "ERROR: value too long for type character varying(500) in column \"notes\""));

        PostingResult<String> result = purchasePostingService.createPurchase(request("S1", null));

        assertTrue(result.hasError(PostingErrorCode.STORAGE_FAILURE));
        assertEquals("Purchase could not be stored", result.getError().getMessage());
    }
}
