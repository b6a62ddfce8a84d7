package com.hhplus.orderengine.presentation.dto;

import com.hhplus.orderengine.application.command.PlaceOrderCommand;

import java.util.List;

public record CreateOrderRequest(
        String userId,
        List<OrderItemRequest> items,
        String shippingAddress
) {

    public record OrderItemRequest(
            String productId,
            Integer quantity
    ) {
    }

    public PlaceOrderCommand toCommand() {
        List<PlaceOrderCommand.OrderItemCommand> itemCommands = items == null ? null : items.stream()
                .map(item -> item == null ? null : new PlaceOrderCommand.OrderItemCommand(item.productId(), item.quantity()))
                .toList();
        return new PlaceOrderCommand(userId, itemCommands, shippingAddress);
    }
}
