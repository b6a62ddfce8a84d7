package com.hhplus.orderengine.application.usecase.order;

import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.service.OrderService;
import org.springframework.stereotype.Service;

/**
 * 주문 상세 조회 UseCase
 *
 * User Story: "사용자가 주문 상세 정보(주문 라인 포함)를 조회한다"
 */
@Service
public class GetOrderUseCase {

    private final OrderService orderService;

    public GetOrderUseCase(OrderService orderService) {
        this.orderService = orderService;
    }

    public OrderDetail execute(String orderId) {
        return orderService.getOrder(orderId);
    }
}
