package com.hhplus.orderengine.application.query;

/**
 * 주문 목록 조회 조건 (모두 선택)
 */
public record GetOrdersQuery(
        String userId,
        String status
) {
}
