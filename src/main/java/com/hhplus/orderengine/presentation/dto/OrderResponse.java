package com.hhplus.orderengine.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.entity.Order;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResponse(
        String id,
        String userId,
        String status,
        BigDecimal total,
        String shippingAddress,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<OrderItemResponse> items      // 목록 조회에서는 생략
) {

    public static OrderResponse from(Order order) {
        return of(order, null);
    }

    public static OrderResponse from(OrderDetail detail) {
        return of(detail.order(), detail.items().stream()
                .map(OrderItemResponse::from)
                .toList());
    }

    private static OrderResponse of(Order order, List<OrderItemResponse> items) {
        return new OrderResponse(
                order.getId(),
                order.getUserId(),
                order.getStatus().getValue(),
                order.getTotal().getAmount(),
                order.getShippingAddress(),
                order.getCreatedAt(),
                order.getUpdatedAt(),
                items
        );
    }
}
