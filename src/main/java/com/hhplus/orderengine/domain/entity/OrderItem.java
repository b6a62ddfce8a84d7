package com.hhplus.orderengine.domain.entity;

import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Quantity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 라인
 *
 * 상품명과 가격은 주문 시점 상품의 스냅샷이며 생성 이후 변경되지 않습니다.
 */
@Entity
@Table(name = "order_items", indexes = {
        @Index(name = "idx_order_items_product_id", columnList = "product_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @Column(nullable = false, length = 36, updatable = false)
    private String productId;

    @Column(nullable = false, updatable = false)
    private String productName;

    @Column(nullable = false, updatable = false)
    private Quantity quantity;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private Money price;

    public OrderItem(Order order, String productId, String productName, Quantity quantity, Money price) {
        this.order = order;
        this.productId = productId;
        this.productName = productName;
        this.quantity = quantity;
        this.price = price;
    }

    public static OrderItem create(Order order, OrderLine line) {
        return new OrderItem(order, line.productId(), line.productName(), line.quantity(), line.unitPrice());
    }

    public Money getSubtotal() {
        return quantity.multiply(price);
    }
}
