package com.flagship.pos_inventory.posting;

import lombok.Builder;
import lombok.Value;

/**
 * Failure half of a {@link PostingResult}.
 *
 * productCode, requested and available are only set for stock shortages
 * and product lookups; they are null otherwise.
 */
@Value
@Builder
public class PostingError {
    PostingErrorCode code;
    String message;
    String productCode;
    Integer requested;
    Integer available;

    public static PostingError of(PostingErrorCode code, String message) {
        return PostingError.builder()
            .code(code)
            .message(message)
            .build();
    }

    public static PostingError emptyCart() {
        return of(PostingErrorCode.EMPTY_CART, "No line items provided");
    }

    public static PostingError customerNotFound(String customerId) {
        return of(PostingErrorCode.CUSTOMER_NOT_FOUND, "Customer not found: " + customerId);
    }

    public static PostingError employeeNotFound(String employeeId) {
        return of(PostingErrorCode.EMPLOYEE_NOT_FOUND, "Employee not found: " + employeeId);
    }

    public static PostingError supplierNotFound(String supplierId) {
        return of(PostingErrorCode.SUPPLIER_NOT_FOUND, "Supplier not found: " + supplierId);
    }

    public static PostingError productNotFound(String productCode) {
        return PostingError.builder()
            .code(PostingErrorCode.PRODUCT_NOT_FOUND)
            .message("Product not found: " + productCode)
            .productCode(productCode)
            .build();
    }

    public static PostingError purchaseNotFound(String purchaseNo) {
        return of(PostingErrorCode.PURCHASE_NOT_FOUND, "Purchase not found: " + purchaseNo);
    }

    public static PostingError insufficientStock(String productCode, int requested, int available) {
        return PostingError.builder()
            .code(PostingErrorCode.INSUFFICIENT_STOCK)
            .message(String.format("Insufficient stock for %s. Requested: %d, Available: %d",
                productCode, requested, available))
            .productCode(productCode)
            .requested(requested)
            .available(available)
            .build();
    }
}
