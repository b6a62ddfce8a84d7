package com.hhplus.orderengine.domain.dto;

import java.math.BigDecimal;

/**
 * 상품 목록 조회 조건 (모든 항목 선택)
 */
public record ProductSearchCondition(
        String category,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        String search
) {

    public static ProductSearchCondition empty() {
        return new ProductSearchCondition(null, null, null, null);
    }
}
