package com.hhplus.orderengine;

import com.hhplus.orderengine.application.command.PlaceOrderCommand;
import com.hhplus.orderengine.application.command.PlaceOrderCommand.OrderItemCommand;
import com.hhplus.orderengine.application.usecase.order.PlaceOrderUseCase;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.entity.User;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.repository.ProductRepository;
import com.hhplus.orderengine.domain.repository.UserRepository;
import com.hhplus.orderengine.domain.service.OrderStatusMachine;
import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Stock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * 실제 MySQL(Testcontainers)에서 SELECT ... FOR UPDATE 기반 재고 정합성 검증
 *
 * Docker 가 없는 환경에서는 건너뜁니다.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class MySqlOrderConcurrencyTest {

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("orderengine")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
        registry.add("spring.datasource.driver-class-name", mysql::getDriverClassName);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private PlaceOrderUseCase placeOrderUseCase;

    @Autowired
    private OrderStatusMachine orderStatusMachine;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private UserRepository userRepository;

    @Test
    @DisplayName("MySQL 에서도 재고 5개 상품에 12명이 동시에 주문하면 5명만 성공한다")
    void placeOrder_NoOverselling() throws InterruptedException {
        // given
        User user = userRepository.save(new User("mysql@example.com", "마이", "secret"));
        Product product = productRepository.save(new Product("MySQL 한정판", null, Money.of("10.00"), Stock.of(5), null));

        int totalThreads = 12;
        ExecutorService executorService = Executors.newFixedThreadPool(totalThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(totalThreads);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger insufficientCount = new AtomicInteger(0);

        // when
        for (int i = 0; i < totalThreads; i++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    placeOrderUseCase.execute(new PlaceOrderCommand(
                            user.getId(), List.of(new OrderItemCommand(product.getId(), 1)), null));
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    if (e.getErrorCode() == ErrorCode.INSUFFICIENT_STOCK) {
                        insufficientCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        doneLatch.await(60, TimeUnit.SECONDS);
        executorService.shutdown();

        // then
        assertThat(successCount.get()).isEqualTo(5);
        assertThat(insufficientCount.get()).isEqualTo(7);
        assertThat(productRepository.findByIdOrThrow(product.getId()).getStockQuantity()).isZero();
    }

    @Test
    @DisplayName("MySQL 에서 주문 취소는 재고를 정확히 되돌린다")
    void cancel_RestoresStock() {
        User user = userRepository.save(new User("mysql-cancel@example.com", "취소", "secret"));
        Product product = productRepository.save(new Product("MySQL 머그", null, Money.of("8.00"), Stock.of(4), null));

        String orderId = placeOrderUseCase.execute(new PlaceOrderCommand(
                user.getId(), List.of(new OrderItemCommand(product.getId(), 4)), "Incheon")).order().getId();
        assertThat(productRepository.findByIdOrThrow(product.getId()).getStockQuantity()).isZero();

        orderStatusMachine.cancel(orderId);

        assertThat(productRepository.findByIdOrThrow(product.getId()).getStockQuantity()).isEqualTo(4);
    }
}
