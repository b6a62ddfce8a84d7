package com.hhplus.orderengine.domain.event;

import com.hhplus.orderengine.domain.enums.OrderStatus;

import java.util.Map;

/**
 * 주문 취소 이벤트 (재고 복구 + 주문 삭제 완료)
 *
 * @param restoredStock 상품 ID → 복구된 수량
 */
public record OrderCancelledEvent(
        String orderId,
        String userId,
        OrderStatus statusAtCancel,
        Map<String, Integer> restoredStock
) {
}
