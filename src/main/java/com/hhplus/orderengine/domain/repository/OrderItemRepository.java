package com.hhplus.orderengine.domain.repository;

import com.hhplus.orderengine.domain.entity.OrderItem;

import java.util.List;

public interface OrderItemRepository {
    List<OrderItem> saveAll(List<OrderItem> orderItems);

    List<OrderItem> findByOrderId(String orderId);

    boolean existsByProductId(String productId);

    void deleteByOrderId(String orderId);
}
