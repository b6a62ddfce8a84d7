package com.hhplus.orderengine.domain.event;

import com.hhplus.orderengine.domain.enums.OrderStatus;

public record OrderStatusChangedEvent(
        String orderId,
        OrderStatus previousStatus,
        OrderStatus newStatus
) {
}
