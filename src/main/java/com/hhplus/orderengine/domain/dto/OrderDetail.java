package com.hhplus.orderengine.domain.dto;

import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.entity.OrderItem;

import java.util.List;

/**
 * 주문과 주문 라인 조회 결과
 */
public record OrderDetail(
        Order order,
        List<OrderItem> items
) {
}
