package com.flagship.pos_inventory.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.api.LineItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

/**
 * Request body of POST /api/purchases.
 */
@Value
public class CreatePurchaseRequest {

    @NotBlank(message = "Supplier ID is required")
    @JsonProperty("supplier_id")
    String supplierId;

    @NotNull(message = "Items are required")
    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    @JsonProperty("notes")
    String notes;
}
