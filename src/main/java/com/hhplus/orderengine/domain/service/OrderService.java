package com.hhplus.orderengine.domain.service;

import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.entity.OrderItem;
import com.hhplus.orderengine.domain.entity.OrderLine;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.event.OrderCreatedEvent;
import com.hhplus.orderengine.domain.repository.OrderItemRepository;
import com.hhplus.orderengine.domain.repository.OrderRepository;
import com.hhplus.orderengine.domain.vo.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * 주문 원장 서비스
 *
 * 주문과 주문 라인의 영속화, 재고 차감을 하나의 트랜잭션으로 커밋합니다.
 */
@Slf4j
@Service
public class OrderService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final StockAdjuster stockAdjuster;
    private final ApplicationEventPublisher eventPublisher;

    public OrderService(OrderRepository orderRepository,
                        OrderItemRepository orderItemRepository,
                        StockAdjuster stockAdjuster,
                        ApplicationEventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.stockAdjuster = stockAdjuster;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 주문 총액 계산 (검증 시점 가격 기준, 이후 재계산하지 않음)
     */
    public Money calculateTotal(List<OrderLine> lines) {
        return lines.stream()
                .map(OrderLine::subtotal)
                .reduce(Money.zero(), Money::add);
    }

    /**
     * 주문 커밋
     *
     * 모든 라인의 재고 차감과 주문/주문 라인 저장이 한 트랜잭션에서 실행됩니다.
     * 어느 라인이든 차감에 실패하면(검증 이후 다른 주문이 재고를 소진한 경우 등)
     * 전체가 롤백되어 주문도, 재고 변경도 남지 않습니다.
     *
     * @param userId 주문자 ID (존재 여부는 호출자가 검증)
     * @param lines 검증 단계에서 가격이 확정된 주문 라인
     * @param shippingAddress 배송지 (null 이면 빈 문자열)
     * @return 커밋된 주문과 주문 라인
     * @throws com.hhplus.orderengine.domain.exception.BusinessException
     *         재고 부족(INSUFFICIENT_STOCK), 총액 상한 초과(INVALID_ARGUMENT)
     */
    @Transactional
    public OrderDetail createOrder(String userId, List<OrderLine> lines, String shippingAddress) {
        // 금액 상한 초과는 재고 변경 전에 INVALID_ARGUMENT 로 실패
        Money total = calculateTotal(lines);

        // 상품 ID 순서로 행 락 획득 (교착 방지)
        lines.stream()
                .sorted(Comparator.comparing(OrderLine::productId))
                .forEach(line -> stockAdjuster.adjust(line.productId(), line.stockDelta()));

        Order order = orderRepository.save(new Order(userId, total, shippingAddress));

        List<OrderItem> items = orderItemRepository.saveAll(lines.stream()
                .map(line -> OrderItem.create(order, line))
                .toList());

        eventPublisher.publishEvent(new OrderCreatedEvent(
                order.getId(),
                userId,
                order.getTotal(),
                lines.stream()
                        .map(line -> new OrderCreatedEvent.Item(line.productId(), line.quantity().getValue()))
                        .toList()
        ));

        return new OrderDetail(order, items);
    }

    /**
     * 주문 상세 조회
     *
     * @throws com.hhplus.orderengine.domain.exception.BusinessException 주문이 없는 경우 (ORDER_NOT_FOUND)
     */
    @Transactional(readOnly = true)
    public OrderDetail getOrder(String orderId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        return new OrderDetail(order, orderItemRepository.findByOrderId(orderId));
    }

    /**
     * 주문 목록 조회 (커밋된 주문만, 최신순)
     */
    @Transactional(readOnly = true)
    public List<Order> getOrders(String userId, OrderStatus status) {
        return orderRepository.findByCondition(userId, status);
    }

    /**
     * 주문과 주문 라인 삭제 (취소 트랜잭션 안에서만 호출)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void removeOrder(Order order) {
        orderItemRepository.deleteByOrderId(order.getId());
        orderRepository.delete(order);
    }
}
