package com.hhplus.orderengine.application.usecase.order;

import com.hhplus.orderengine.application.command.PlaceOrderCommand;
import com.hhplus.orderengine.domain.dto.OrderDetail;
import com.hhplus.orderengine.domain.entity.OrderLine;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.repository.UserRepository;
import com.hhplus.orderengine.domain.service.OrderService;
import com.hhplus.orderengine.domain.service.ProductService;
import com.hhplus.orderengine.domain.vo.Quantity;
import com.hhplus.orderengine.infrastructure.lock.StockLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 주문 생성 UseCase
 *
 * User Story: "사용자가 장바구니의 상품들로 주문한다"
 *
 * 1. 필수 입력 검증 (사용자 ID, 주문 라인)
 * 2. 사용자 존재 확인
 * 3. 요청 순서대로 상품 존재/재고 확인 및 가격 스냅샷 (트랜잭션 밖, 읽기 전용)
 * 4. 상품 락 획득 → 커밋 트랜잭션 (재고 재검증 + 차감 + 주문 저장) → 락 해제
 *
 * 3단계 검증을 통과해도 4단계에서 다른 주문이 먼저 재고를 소진했다면
 * 전체가 롤백되어 INSUFFICIENT_STOCK 으로 실패합니다. 실패한 호출은 아무 상태도 남기지 않으므로
 * 호출자가 그대로 재시도할 수 있습니다.
 */
@Slf4j
@Service
public class PlaceOrderUseCase {

    private final UserRepository userRepository;
    private final ProductService productService;
    private final OrderService orderService;
    private final StockLockManager stockLockManager;

    public PlaceOrderUseCase(UserRepository userRepository,
                             ProductService productService,
                             OrderService orderService,
                             StockLockManager stockLockManager) {
        this.userRepository = userRepository;
        this.productService = productService;
        this.orderService = orderService;
        this.stockLockManager = stockLockManager;
    }

    public OrderDetail execute(PlaceOrderCommand command) {
        // 1. 필수 입력 검증
        validateRequiredFields(command);

        // 2. 사용자 확인
        if (!userRepository.existsById(command.userId())) {
            throw new BusinessException(ErrorCode.USER_NOT_FOUND);
        }

        // 3. 상품/재고 검증 및 가격 스냅샷
        List<OrderLine> lines = new ArrayList<>();
        for (PlaceOrderCommand.OrderItemCommand item : command.items()) {
            Quantity quantity = new Quantity(item.quantity());
            Product product = productService.getProduct(item.productId());

            if (!product.hasSufficientStock(quantity)) {
                log.warn("주문 검증 실패 - 재고 부족: productId={}, stock={}, requested={}",
                        product.getId(), product.getStockQuantity(), quantity.getValue());
                throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, product.getName());
            }
            lines.add(OrderLine.snapshot(product, quantity));
        }

        // 4. 상품 락 + 커밋 트랜잭션
        Set<String> productIds = lines.stream()
                .map(OrderLine::productId)
                .collect(Collectors.toSet());

        OrderDetail detail = stockLockManager.executeWithLocks(productIds, () ->
                orderService.createOrder(command.userId(), lines, command.shippingAddress())
        );

        log.info("주문 생성 완료: orderId={}, userId={}, items={}, total={}",
                detail.order().getId(), command.userId(), lines.size(), detail.order().getTotal());
        return detail;
    }

    private void validateRequiredFields(PlaceOrderCommand command) {
        if (command.userId() == null || command.userId().isBlank()
                || command.items() == null || command.items().isEmpty()) {
            throw new BusinessException(ErrorCode.MISSING_FIELDS, "userId, items (array)");
        }
        for (PlaceOrderCommand.OrderItemCommand item : command.items()) {
            if (item == null || item.productId() == null || item.productId().isBlank() || item.quantity() == null) {
                throw new BusinessException(ErrorCode.MISSING_FIELDS, "items[].productId, items[].quantity");
            }
        }
    }
}
