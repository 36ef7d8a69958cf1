package com.flagship.pos_inventory.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request body of POST /api/inventory/{code}/adjustments.
 * A negative delta removes stock (damage, shrinkage), a positive one adds it.
 */
@Value
public class StockAdjustmentRequest {

    @NotNull(message = "Delta is required")
    @JsonProperty("delta")
    Integer delta;

    @Size(max = 200, message = "Reason cannot exceed 200 characters")
    @JsonProperty("reason")
    String reason;
}
