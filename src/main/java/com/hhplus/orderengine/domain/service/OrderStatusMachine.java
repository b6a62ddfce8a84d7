package com.hhplus.orderengine.domain.service;

import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.entity.OrderItem;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.event.OrderCancelledEvent;
import com.hhplus.orderengine.domain.event.OrderStatusChangedEvent;
import com.hhplus.orderengine.domain.repository.OrderItemRepository;
import com.hhplus.orderengine.domain.repository.OrderRepository;
import com.hhplus.orderengine.infrastructure.lock.StockLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 주문 상태 머신
 *
 * - transition: delivered/cancelled 가 아닌 주문을 인식 가능한 임의의 상태로 변경
 * - cancel: delivered 가 아닌 주문의 재고를 복구하고 주문을 삭제 (하나의 트랜잭션)
 */
@Slf4j
@Service
public class OrderStatusMachine {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final OrderService orderService;
    private final StockAdjuster stockAdjuster;
    private final StockLockManager stockLockManager;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;

    public OrderStatusMachine(OrderRepository orderRepository,
                              OrderItemRepository orderItemRepository,
                              OrderService orderService,
                              StockAdjuster stockAdjuster,
                              StockLockManager stockLockManager,
                              TransactionTemplate transactionTemplate,
                              ApplicationEventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.orderService = orderService;
        this.stockAdjuster = stockAdjuster;
        this.stockLockManager = stockLockManager;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 주문 상태 변경
     *
     * 상태 값 검증이 주문 조회보다 먼저 수행됩니다.
     *
     * @param orderId 주문 ID
     * @param status 변경할 상태 문자열 (pending, processing, shipped, delivered, cancelled)
     * @return 변경된 주문
     * @throws com.hhplus.orderengine.domain.exception.BusinessException
     *         INVALID_STATUS, ORDER_NOT_FOUND, INVALID_STATUS_TRANSITION
     */
    @Transactional
    public Order transition(String orderId, String status) {
        OrderStatus newStatus = OrderStatus.from(status);

        Order order = orderRepository.findByIdWithLockOrThrow(orderId);
        OrderStatus previousStatus = order.getStatus();
        order.changeStatus(newStatus);

        eventPublisher.publishEvent(new OrderStatusChangedEvent(orderId, previousStatus, newStatus));
        log.info("주문 상태 변경: orderId={}, {} -> {}", orderId, previousStatus.getValue(), newStatus.getValue());
        return order;
    }

    /**
     * 주문 취소
     *
     * 주문 라인 상품들의 락을 잡은 뒤 한 트랜잭션에서
     * 주문 재조회(행 락) → 상태 재검증 → 재고 복구 → 주문/주문 라인 삭제 순으로 실행합니다.
     * 어느 단계든 실패하면 재고 복구와 삭제가 모두 롤백됩니다.
     *
     * @throws com.hhplus.orderengine.domain.exception.BusinessException
     *         ORDER_NOT_FOUND, CANNOT_CANCEL_DELIVERED
     */
    public void cancel(String orderId) {
        OrderDetail detail = orderService.getOrder(orderId);
        detail.order().validateCancellable();

        List<String> productIds = detail.items().stream()
                .map(OrderItem::getProductId)
                .toList();

        Map<String, Integer> restored = stockLockManager.executeWithLocks(productIds, () ->
                transactionTemplate.execute(txStatus -> restoreAndRemove(orderId))
        );

        log.info("주문 취소 완료: orderId={}, restored={}", orderId, restored);
    }

    private Map<String, Integer> restoreAndRemove(String orderId) {
        Order order = orderRepository.findByIdWithLockOrThrow(orderId);
        // 락 대기 중 배송 완료 처리되었을 수 있으므로 재검증
        order.validateCancellable();

        Map<String, Integer> restored = new LinkedHashMap<>();
        orderItemRepository.findByOrderId(orderId).stream()
                .sorted(Comparator.comparing(OrderItem::getProductId))
                .forEach(item -> {
                    int quantity = item.getQuantity().getValue();
                    stockAdjuster.adjust(item.getProductId(), quantity);
                    restored.merge(item.getProductId(), quantity, Integer::sum);
                });

        OrderStatus statusAtCancel = order.getStatus();
        String userId = order.getUserId();
        orderService.removeOrder(order);

        eventPublisher.publishEvent(new OrderCancelledEvent(orderId, userId, statusAtCancel, restored));
        return restored;
    }
}
