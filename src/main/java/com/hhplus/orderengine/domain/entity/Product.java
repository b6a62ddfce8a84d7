package com.hhplus.orderengine.domain.entity;

import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Quantity;
import com.hhplus.orderengine.domain.vo.Stock;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private Money price;

    @Column(nullable = false)
    private Stock stock;

    @Column(length = 100)
    private String category;

    private String imageUrl;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public Product(String name, String description, Money price, Stock stock, String category, String imageUrl) {
        this.name = name;
        this.description = description;
        this.price = price;
        this.stock = stock != null ? stock : Stock.empty();
        this.category = category;
        this.imageUrl = imageUrl;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public Product(String name, String description, Money price, Stock stock, String category) {
        this(name, description, price, stock, category, null);
    }

    /**
     * 부분 수정 - null 인 항목은 기존 값을 유지합니다.
     * 재고는 StockAdjuster 를 통해서만 변경됩니다.
     */
    public void update(String name, String description, Money price, String category, String imageUrl) {
        if (name != null) {
            this.name = name;
        }
        if (description != null) {
            this.description = description;
        }
        if (price != null) {
            this.price = price;
        }
        if (category != null) {
            this.category = category;
        }
        if (imageUrl != null) {
            this.imageUrl = imageUrl;
        }
    }

    /**
     * 재고 증감 적용
     *
     * @param delta 음수: 차감, 양수: 복구/입고
     * @return 변경 후 재고
     */
    public int adjustStock(int delta) {
        this.stock = this.stock.apply(delta);
        return this.stock.getQuantity();
    }

    public boolean canAdjustStock(int delta) {
        return this.stock.canApply(delta);
    }

    public boolean exceedsStockLimit(int delta) {
        return this.stock.exceedsLimit(delta);
    }

    public boolean hasSufficientStock(Quantity requiredQuantity) {
        return this.stock.isSufficientFor(requiredQuantity);
    }

    public int getStockQuantity() {
        return this.stock.getQuantity();
    }
}
