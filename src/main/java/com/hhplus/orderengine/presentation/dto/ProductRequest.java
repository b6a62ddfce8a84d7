package com.hhplus.orderengine.presentation.dto;

import com.hhplus.orderengine.application.command.CreateProductCommand;
import com.hhplus.orderengine.application.command.UpdateProductCommand;

import java.math.BigDecimal;

/**
 * 상품 등록/수정 요청 (수정 시 null 항목은 유지)
 */
public record ProductRequest(
        String name,
        String description,
        BigDecimal price,
        Integer stock,
        String category,
        String imageUrl
) {

    public CreateProductCommand toCreateCommand() {
        return new CreateProductCommand(name, description, price, stock, category, imageUrl);
    }

    public UpdateProductCommand toUpdateCommand() {
        return new UpdateProductCommand(name, description, price, stock, category, imageUrl);
    }
}
