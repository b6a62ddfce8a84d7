package com.hhplus.orderengine.application.command;

import java.util.List;

public record PlaceOrderCommand(
        String userId,
        List<OrderItemCommand> items,
        String shippingAddress
) {

    public record OrderItemCommand(
            String productId,
            Integer quantity
    ) {
    }
}
