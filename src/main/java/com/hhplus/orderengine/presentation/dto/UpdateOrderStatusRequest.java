package com.hhplus.orderengine.presentation.dto;

public record UpdateOrderStatusRequest(
        String status
) {
}
