package com.hhplus.orderengine.application.command;

import java.math.BigDecimal;

public record CreateProductCommand(
        String name,
        String description,
        BigDecimal price,
        Integer stock,
        String category,
        String imageUrl
) {
}
