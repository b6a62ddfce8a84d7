package com.hhplus.orderengine.domain.repository;

import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {
    Order save(Order order);

    Optional<Order> findById(String id);

    /**
     * 비관적 락을 사용한 주문 조회
     * 상태 변경/취소가 동시에 같은 주문을 수정하는 것을 방지
     */
    Optional<Order> findByIdWithLock(String id);

    /**
     * 사용자/상태 조건 조회 (null 조건은 무시, 최신순)
     */
    List<Order> findByCondition(String userId, OrderStatus status);

    void delete(Order order);

    default Order findByIdOrThrow(String id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    default Order findByIdWithLockOrThrow(String id) {
        return findByIdWithLock(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }
}
