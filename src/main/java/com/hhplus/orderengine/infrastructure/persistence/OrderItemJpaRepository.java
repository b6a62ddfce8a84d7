package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.entity.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface OrderItemJpaRepository extends JpaRepository<OrderItem, String> {

    @Query("SELECT oi FROM OrderItem oi WHERE oi.order.id = :orderId ORDER BY oi.productId")
    List<OrderItem> findByOrderId(@Param("orderId") String orderId);

    boolean existsByProductId(String productId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OrderItem oi WHERE oi.order.id = :orderId")
    int deleteByOrderId(@Param("orderId") String orderId);
}
