package com.hhplus.orderengine.domain.service;

import com.hhplus.orderengine.BaseIntegrationTest;
import com.hhplus.orderengine.application.command.PlaceOrderCommand;
import com.hhplus.orderengine.application.command.PlaceOrderCommand.OrderItemCommand;
import com.hhplus.orderengine.application.usecase.order.PlaceOrderUseCase;
import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.entity.User;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.repository.OrderItemRepository;
import com.hhplus.orderengine.domain.repository.ProductRepository;
import com.hhplus.orderengine.domain.repository.UserRepository;
import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrderStatusMachineIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private OrderStatusMachine orderStatusMachine;

    @Autowired
    private OrderService orderService;

    @Autowired
    private PlaceOrderUseCase placeOrderUseCase;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private UserRepository userRepository;

    private User user;
    private Product product;

    @BeforeEach
    void setUpData() {
        user = userRepository.save(new User("status@example.com", "상태", "secret"));
        product = productRepository.save(new Product("Tumbler", null, Money.of("15.00"), Stock.of(5), "kitchen"));
    }

    private OrderDetail placeOrder(int quantity) {
        return placeOrderUseCase.execute(new PlaceOrderCommand(
                user.getId(), List.of(new OrderItemCommand(product.getId(), quantity)), "Busan"));
    }

    private int currentStock() {
        return productRepository.findByIdOrThrow(product.getId()).getStockQuantity();
    }

    @Test
    @DisplayName("상태를 변경하면 새 상태가 저장된다")
    void transition_Success() {
        // given
        String orderId = placeOrder(1).order().getId();

        // when
        Order changed = orderStatusMachine.transition(orderId, "processing");

        // then
        assertThat(changed.getStatus()).isEqualTo(OrderStatus.PROCESSING);
        assertThat(orderService.getOrder(orderId).order().getStatus()).isEqualTo(OrderStatus.PROCESSING);
    }

    @Test
    @DisplayName("순서를 건너뛰는 전이도 허용된다 (pending → delivered)")
    void transition_SkipsAhead() {
        String orderId = placeOrder(1).order().getId();

        Order changed = orderStatusMachine.transition(orderId, "DELIVERED");

        assertThat(changed.getStatus()).isEqualTo(OrderStatus.DELIVERED);
    }

    @Test
    @DisplayName("인식할 수 없는 상태 값은 주문 조회 전에 INVALID_STATUS 로 실패한다")
    void transition_InvalidStatus() {
        assertThatThrownBy(() -> orderStatusMachine.transition("missing-order", "lost"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_STATUS);
    }

    @Test
    @DisplayName("존재하지 않는 주문의 상태 변경은 ORDER_NOT_FOUND 로 실패한다")
    void transition_OrderNotFound() {
        assertThatThrownBy(() -> orderStatusMachine.transition("missing-order", "shipped"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ORDER_NOT_FOUND);
    }

    @Test
    @DisplayName("delivered 주문은 다른 상태로 바꿀 수 없다")
    void transition_FromDelivered() {
        String orderId = placeOrder(1).order().getId();
        orderStatusMachine.transition(orderId, "delivered");

        assertThatThrownBy(() -> orderStatusMachine.transition(orderId, "shipped"))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Order status cannot change from delivered");

        assertThat(orderService.getOrder(orderId).order().getStatus()).isEqualTo(OrderStatus.DELIVERED);
    }

    @Test
    @DisplayName("주문 취소 시 재고가 복구되고 주문과 주문 라인이 삭제된다")
    void cancel_RestoresStock() {
        // given
        String orderId = placeOrder(5).order().getId();
        assertThat(currentStock()).isZero();

        // when
        orderStatusMachine.cancel(orderId);

        // then
        assertThat(currentStock()).isEqualTo(5);
        assertThat(orderItemRepository.findByOrderId(orderId)).isEmpty();
        assertThatThrownBy(() -> orderService.getOrder(orderId))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ORDER_NOT_FOUND);
    }

    @Test
    @DisplayName("배송 중인 주문도 취소할 수 있다")
    void cancel_Shipped() {
        String orderId = placeOrder(2).order().getId();
        orderStatusMachine.transition(orderId, "processing");
        orderStatusMachine.transition(orderId, "shipped");

        orderStatusMachine.cancel(orderId);

        assertThat(currentStock()).isEqualTo(5);
    }

    @Test
    @DisplayName("배송 완료된 주문은 취소할 수 없고 아무것도 바뀌지 않는다")
    void cancel_Delivered() {
        // given
        String orderId = placeOrder(2).order().getId();
        orderStatusMachine.transition(orderId, "processing");
        orderStatusMachine.transition(orderId, "shipped");
        orderStatusMachine.transition(orderId, "delivered");

        // when & then
        assertThatThrownBy(() -> orderStatusMachine.cancel(orderId))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Cannot cancel delivered order");

        assertThat(currentStock()).isEqualTo(3);
        OrderDetail detail = orderService.getOrder(orderId);
        assertThat(detail.order().getStatus()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(detail.items()).hasSize(1);
    }

    @Test
    @DisplayName("cancelled 상태로만 바뀐 주문은 취소 시 재고가 복구된다")
    void cancel_AfterCancelledStatus() {
        String orderId = placeOrder(3).order().getId();
        orderStatusMachine.transition(orderId, "cancelled");
        assertThat(currentStock()).isEqualTo(2);

        orderStatusMachine.cancel(orderId);

        assertThat(currentStock()).isEqualTo(5);
    }

    @Test
    @DisplayName("존재하지 않는 주문 취소는 ORDER_NOT_FOUND 로 실패한다")
    void cancel_NotFound() {
        assertThatThrownBy(() -> orderStatusMachine.cancel("missing-order"))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Order not found");
    }
}
