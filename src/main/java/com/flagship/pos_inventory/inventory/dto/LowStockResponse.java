package com.flagship.pos_inventory.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_inventory.inventory.LowStockItem;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LowStockResponse {

    @JsonProperty("product_code")
    String productCode;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("current_stock")
    int currentStock;

    @JsonProperty("min_stock_level")
    int minStockLevel;

    @JsonProperty("shortfall")
    int shortfall;

    public static LowStockResponse from(LowStockItem item) {
        return LowStockResponse.builder()
            .productCode(item.getProductCode())
            .productName(item.getProductName())
            .currentStock(item.getCurrentStock())
            .minStockLevel(item.getMinStockLevel())
            .shortfall(item.getShortfall())
            .build();
    }
}
