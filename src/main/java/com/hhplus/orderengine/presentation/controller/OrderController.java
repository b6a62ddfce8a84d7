package com.hhplus.orderengine.presentation.controller;

import com.hhplus.orderengine.application.query.GetOrdersQuery;
import com.hhplus.orderengine.application.usecase.order.GetOrderUseCase;
import com.hhplus.orderengine.application.usecase.order.GetOrdersUseCase;
import com.hhplus.orderengine.application.usecase.order.PlaceOrderUseCase;
import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.service.OrderStatusMachine;
import com.hhplus.orderengine.presentation.dto.CreateOrderRequest;
import com.hhplus.orderengine.presentation.dto.MessageResponse;
import com.hhplus.orderengine.presentation.dto.OrderResponse;
import com.hhplus.orderengine.presentation.dto.UpdateOrderStatusRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final PlaceOrderUseCase placeOrderUseCase;
    private final GetOrderUseCase getOrderUseCase;
    private final GetOrdersUseCase getOrdersUseCase;
    private final OrderStatusMachine orderStatusMachine;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@RequestBody CreateOrderRequest request) {
        OrderDetail detail = placeOrderUseCase.execute(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(detail));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponse.from(getOrderUseCase.execute(orderId)));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrders(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String status) {
        List<OrderResponse> response = getOrdersUseCase.execute(new GetOrdersQuery(userId, status)).stream()
                .map(OrderResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable String orderId,
            @RequestBody UpdateOrderStatusRequest request) {
        Order order = orderStatusMachine.transition(orderId, request.status());
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    /**
     * 주문 취소 (재고 복구 후 주문 삭제)
     */
    @DeleteMapping("/{orderId}")
    public ResponseEntity<MessageResponse> cancelOrder(@PathVariable String orderId) {
        orderStatusMachine.cancel(orderId);
        return ResponseEntity.ok(MessageResponse.of("Order cancelled successfully"));
    }
}
