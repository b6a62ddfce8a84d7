package com.hhplus.orderengine.domain.event;

import com.hhplus.orderengine.domain.vo.Money;

import java.util.List;

/**
 * 주문 커밋 이벤트
 *
 * 트랜잭션 커밋 후에만 처리됩니다.
 */
public record OrderCreatedEvent(
        String orderId,
        String userId,
        Money total,
        List<Item> items
) {

    public record Item(String productId, int quantity) {
    }
}
