package com.hhplus.orderengine.domain.dto;

public record StockResult(
        String productId,
        int stock
) {
}
