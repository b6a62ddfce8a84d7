package com.hhplus.orderengine.application.usecase.order;

import com.hhplus.orderengine.application.query.GetOrdersQuery;
import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.service.OrderService;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 주문 목록 조회 UseCase
 *
 * User Story: "관리자/사용자가 사용자·상태 조건으로 주문 목록을 조회한다"
 */
@Service
public class GetOrdersUseCase {

    private final OrderService orderService;

    public GetOrdersUseCase(OrderService orderService) {
        this.orderService = orderService;
    }

    public List<Order> execute(GetOrdersQuery query) {
        OrderStatus status = hasText(query.status()) ? OrderStatus.from(query.status()) : null;
        String userId = hasText(query.userId()) ? query.userId() : null;
        return orderService.getOrders(userId, status);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
