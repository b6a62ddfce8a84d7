package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.entity.OrderItem;
import com.hhplus.orderengine.domain.repository.OrderItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class OrderItemRepositoryImpl implements OrderItemRepository {

    private final OrderItemJpaRepository orderItemJpaRepository;

    @Override
    public List<OrderItem> saveAll(List<OrderItem> orderItems) {
        return orderItemJpaRepository.saveAll(orderItems);
    }

    @Override
    public List<OrderItem> findByOrderId(String orderId) {
        return orderItemJpaRepository.findByOrderId(orderId);
    }

    @Override
    public boolean existsByProductId(String productId) {
        return orderItemJpaRepository.existsByProductId(productId);
    }

    @Override
    public void deleteByOrderId(String orderId) {
        orderItemJpaRepository.deleteByOrderId(orderId);
    }
}
