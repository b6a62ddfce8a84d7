package com.hhplus.orderengine.application.command;

import java.math.BigDecimal;

/**
 * 상품 부분 수정 명령 (null 항목은 변경하지 않음)
 *
 * stock 은 목표 재고이며, 현재 재고와의 차이만큼 StockAdjuster 를 통해 반영됩니다.
 */
public record UpdateProductCommand(
        String name,
        String description,
        BigDecimal price,
        Integer stock,
        String category,
        String imageUrl
) {
}
