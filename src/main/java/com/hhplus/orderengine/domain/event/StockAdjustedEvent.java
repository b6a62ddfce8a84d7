package com.hhplus.orderengine.domain.event;

/**
 * 관리자 재고 조정 이벤트
 */
public record StockAdjustedEvent(
        String productId,
        int delta,
        int stock
) {
}
