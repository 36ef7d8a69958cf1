package com.flagship.pos_inventory.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.posting.LineItem;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a sale or purchase request body.
 *
 * Quantity bounds differ between sales and purchases and are checked by
 * the posting engines.
 */
@Value
public class LineItemRequest {

    @NotBlank(message = "Product code is required")
    @JsonProperty("product_code")
    String productCode;

    @NotNull(message = "Quantity is required")
    @JsonProperty("quantity")
    Integer quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.00", message = "Unit price cannot be negative")
    @DecimalMax(value = "99999999.99", message = "Unit price cannot exceed 99999999.99")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    public LineItem toLineItem() {
        return LineItem.of(productCode, quantity, unitPrice);
    }
}
