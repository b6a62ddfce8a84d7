package com.hhplus.orderengine.presentation.dto;

/**
 * 재고 조정 요청 (quantity: 증감량, 음수 가능)
 */
public record StockAdjustRequest(
        Integer quantity
) {
}
