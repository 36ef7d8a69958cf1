package com.flagship.pos_inventory.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.inventory.InventoryRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class InventoryResponse {

    @JsonProperty("product_code")
    String productCode;

    @JsonProperty("current_stock")
    int currentStock;

    @JsonProperty("last_updated")
    LocalDateTime lastUpdated;

    public static InventoryResponse from(InventoryRecord record) {
        return InventoryResponse.builder()
            .productCode(record.getProductCode())
            .currentStock(record.getCurrentStock())
            .lastUpdated(record.getLastUpdated())
            .build();
    }
}
