package com.hhplus.orderengine.domain.service;

import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 재고 증감 원자 연산
 *
 * 주문 커밋(차감), 주문 취소(복구), 관리자 재고 조정이 모두 이 연산을 거칩니다.
 * 비관적 락(SELECT ... FOR UPDATE)으로 상품 행을 잠근 상태에서
 * "재고 확인 + 변경"을 수행하므로 같은 상품에 대한 동시 변경이 같은 값을 읽지 않습니다.
 *
 * 호출자가 연 트랜잭션 안에서만 실행됩니다 (MANDATORY).
 * 실패 시 예외가 트랜잭션을 rollback-only 로 만들어, 같은 작업 단위에서
 * 이미 적용된 다른 상품의 변경도 함께 취소됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StockAdjuster {

    private final ProductRepository productRepository;

    /**
     * 재고 증감
     *
     * @param productId 상품 ID
     * @param delta 증감량 (음수: 차감, 양수: 복구/입고)
     * @return 변경 후 재고
     * @throws BusinessException 상품이 없거나(PRODUCT_NOT_FOUND) 결과가 음수(INSUFFICIENT_STOCK)
     *         또는 int 최대값 초과(INVALID_ARGUMENT)인 경우
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int adjust(String productId, int delta) {
        Product product = productRepository.findByIdWithLockOrThrow(productId);

        if (product.exceedsStockLimit(delta)) {
            log.warn("재고 상한 초과: productId={}, stock={}, delta={}", productId, product.getStockQuantity(), delta);
            throw new BusinessException(ErrorCode.INVALID_ARGUMENT, "Stock cannot exceed " + Integer.MAX_VALUE);
        }
        if (!product.canAdjustStock(delta)) {
            log.warn("재고 부족: productId={}, stock={}, delta={}", productId, product.getStockQuantity(), delta);
            throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, product.getName());
        }

        int newStock = product.adjustStock(delta);
        log.debug("재고 변경: productId={}, delta={}, stock={}", productId, delta, newStock);
        // 더티 체킹으로 커밋 시 반영
        return newStock;
    }
}
