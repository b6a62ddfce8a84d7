package com.hhplus.orderengine.presentation.dto;

import com.hhplus.orderengine.domain.entity.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
        String id,
        String productId,
        String productName,
        int quantity,
        BigDecimal price,
        BigDecimal subtotal
) {

    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getId(),
                item.getProductId(),
                item.getProductName(),
                item.getQuantity().getValue(),
                item.getPrice().getAmount(),
                item.getSubtotal().getAmount()
        );
    }
}
