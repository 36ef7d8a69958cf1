package com.flagship.pos_inventory.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.api.LineItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request body of POST /api/sales.
 *
 * An empty item list passes bean validation on purpose: the sale engine
 * answers it with EMPTY_CART.
 */
@Value
public class CreateSaleRequest {

    @NotBlank(message = "Customer ID is required")
    @JsonProperty("customer_id")
    String customerId;

    @NotBlank(message = "Employee ID is required")
    @JsonProperty("employee_id")
    String employeeId;

    @JsonProperty("discount")
    BigDecimal discount;

    @NotNull(message = "Items are required")
    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;
}
