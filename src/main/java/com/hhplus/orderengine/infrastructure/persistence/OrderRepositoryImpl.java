package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderRepositoryImpl implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(String id) {
        return orderJpaRepository.findById(id);
    }

    @Override
    public Optional<Order> findByIdWithLock(String id) {
        return orderJpaRepository.findByIdWithLock(id);
    }

    @Override
    public List<Order> findByCondition(String userId, OrderStatus status) {
        if (userId != null && status != null) {
            return orderJpaRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status);
        }
        if (userId != null) {
            return orderJpaRepository.findByUserIdOrderByCreatedAtDesc(userId);
        }
        if (status != null) {
            return orderJpaRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        return orderJpaRepository.findAllByOrderByCreatedAtDesc();
    }

    @Override
    public void delete(Order order) {
        orderJpaRepository.delete(order);
    }
}
