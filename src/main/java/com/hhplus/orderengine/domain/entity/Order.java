package com.hhplus.orderengine.domain.entity;

import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_user_id", columnList = "user_id"),
        @Index(name = "idx_orders_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    // 사용자는 식별자로만 참조 (소유 관계 아님)
    @Column(nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    // 주문 시점에 확정, 이후 재계산하지 않음
    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private Money total;

    @Column(nullable = false)
    private String shippingAddress;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public Order(String userId, Money total, String shippingAddress) {
        this.userId = userId;
        this.total = total;
        this.shippingAddress = shippingAddress != null ? shippingAddress : "";
        this.status = OrderStatus.PENDING;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * 상태 변경
     *
     * delivered / cancelled 주문은 더 이상 상태를 바꿀 수 없습니다.
     * 그 외에는 인식 가능한 어떤 상태로든 변경할 수 있습니다.
     */
    public void changeStatus(OrderStatus newStatus) {
        if (this.status.isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION, this.status.getValue());
        }
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 취소 가능 여부 검증
     */
    public void validateCancellable() {
        if (!this.status.isCancellable()) {
            throw new BusinessException(ErrorCode.CANNOT_CANCEL_DELIVERED);
        }
    }
}
