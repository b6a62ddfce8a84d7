package com.hhplus.orderengine.presentation.dto;

import com.hhplus.orderengine.domain.dto.StockResult;

public record StockResponse(
        String id,
        int stock
) {

    public static StockResponse from(StockResult result) {
        return new StockResponse(result.productId(), result.stock());
    }
}
