package com.hhplus.orderengine.domain.entity;

import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Quantity;

/**
 * 검증 단계에서 확정된 주문 라인 (상품, 수량, 가격 스냅샷)
 *
 * 커밋 전까지는 영속화되지 않는 값 객체입니다.
 */
public record OrderLine(
        String productId,
        String productName,
        Quantity quantity,
        Money unitPrice
) {

    public static OrderLine snapshot(Product product, Quantity quantity) {
        return new OrderLine(product.getId(), product.getName(), quantity, product.getPrice());
    }

    public Money subtotal() {
        return quantity.multiply(unitPrice);
    }

    public int stockDelta() {
        return -quantity.getValue();
    }
}
