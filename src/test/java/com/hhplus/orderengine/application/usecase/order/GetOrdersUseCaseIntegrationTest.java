package com.hhplus.orderengine.application.usecase.order;

import com.hhplus.orderengine.BaseIntegrationTest;
import com.hhplus.orderengine.application.command.PlaceOrderCommand;
import com.hhplus.orderengine.application.command.PlaceOrderCommand.OrderItemCommand;
import com.hhplus.orderengine.application.query.GetOrdersQuery;
import com.hhplus.orderengine.domain.entity.Order;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.entity.User;
import com.hhplus.orderengine.domain.enums.OrderStatus;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.repository.ProductRepository;
import com.hhplus.orderengine.domain.repository.UserRepository;
import com.hhplus.orderengine.domain.service.OrderStatusMachine;
import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class GetOrdersUseCaseIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private GetOrdersUseCase getOrdersUseCase;

    @Autowired
    private PlaceOrderUseCase placeOrderUseCase;

    @Autowired
    private OrderStatusMachine orderStatusMachine;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private UserRepository userRepository;

    private User alice;
    private User bob;

    // alice: pending 1건, shipped 1건 / bob: pending 1건
    private String alicePending;
    private String aliceShipped;
    private String bobPending;

    @BeforeEach
    void setUpOrders() {
        alice = userRepository.save(new User("alice@example.com", "앨리스", "secret"));
        bob = userRepository.save(new User("bob@example.com", "밥", "secret"));
        Product product = productRepository.save(new Product("Pencil", null, Money.of("1.00"), Stock.of(100), null));

        alicePending = place(alice, product);
        aliceShipped = place(alice, product);
        bobPending = place(bob, product);
        orderStatusMachine.transition(aliceShipped, "shipped");
    }

    private String place(User user, Product product) {
        return placeOrderUseCase.execute(new PlaceOrderCommand(
                user.getId(), List.of(new OrderItemCommand(product.getId(), 1)), null)).order().getId();
    }

    private List<String> idsOf(List<Order> orders) {
        return orders.stream().map(Order::getId).toList();
    }

    @Test
    @DisplayName("조건이 없으면 전체 주문을 최신순으로 조회한다")
    void getOrders_All() {
        List<Order> orders = getOrdersUseCase.execute(new GetOrdersQuery(null, null));

        assertThat(idsOf(orders)).containsExactlyInAnyOrder(alicePending, aliceShipped, bobPending);
        assertThat(orders).isSortedAccordingTo(Comparator.comparing(Order::getCreatedAt).reversed());
    }

    @Test
    @DisplayName("빈 문자열 조건은 조건 없음으로 처리한다")
    void getOrders_BlankFilters() {
        List<Order> orders = getOrdersUseCase.execute(new GetOrdersQuery("  ", ""));

        assertThat(orders).hasSize(3);
    }

    @Test
    @DisplayName("사용자 ID 로 필터링한다")
    void getOrders_ByUser() {
        List<Order> orders = getOrdersUseCase.execute(new GetOrdersQuery(alice.getId(), null));

        assertThat(idsOf(orders)).containsExactlyInAnyOrder(alicePending, aliceShipped);
        assertThat(orders).isSortedAccordingTo(Comparator.comparing(Order::getCreatedAt).reversed());
    }

    @Test
    @DisplayName("상태로 필터링한다 (대소문자 무시)")
    void getOrders_ByStatus() {
        List<Order> pending = getOrdersUseCase.execute(new GetOrdersQuery(null, "PENDING"));
        List<Order> shipped = getOrdersUseCase.execute(new GetOrdersQuery(null, "shipped"));

        assertThat(idsOf(pending)).containsExactlyInAnyOrder(alicePending, bobPending);
        assertThat(pending).allMatch(order -> order.getStatus() == OrderStatus.PENDING);
        assertThat(idsOf(shipped)).containsExactly(aliceShipped);
    }

    @Test
    @DisplayName("사용자와 상태를 함께 지정하면 두 조건을 모두 만족하는 주문만 조회한다")
    void getOrders_ByUserAndStatus() {
        List<Order> alicePendingOrders = getOrdersUseCase.execute(new GetOrdersQuery(alice.getId(), "pending"));
        List<Order> bobShippedOrders = getOrdersUseCase.execute(new GetOrdersQuery(bob.getId(), "shipped"));

        assertThat(idsOf(alicePendingOrders)).containsExactly(alicePending);
        assertThat(bobShippedOrders).isEmpty();
    }

    @Test
    @DisplayName("인식할 수 없는 상태 조건은 INVALID_STATUS 로 실패한다")
    void getOrders_InvalidStatus() {
        assertThatThrownBy(() -> getOrdersUseCase.execute(new GetOrdersQuery(null, "bogus")))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_STATUS);
    }

    @Test
    @DisplayName("취소된 주문은 목록에서 사라진다")
    void getOrders_AfterCancel() {
        orderStatusMachine.cancel(bobPending);

        List<Order> orders = getOrdersUseCase.execute(new GetOrdersQuery(bob.getId(), null));

        assertThat(orders).isEmpty();
    }
}
