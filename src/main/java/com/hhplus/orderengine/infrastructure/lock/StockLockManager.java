package com.hhplus.orderengine.infrastructure.lock;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * 상품 재고 락
 *
 * 주어진 상품들의 락을 상품 ID 오름차순으로 모두 획득한 뒤 작업을 실행하고,
 * 작업(트랜잭션 커밋 포함)이 끝난 후 해제합니다.
 * 정렬된 순서로 획득하므로 여러 상품을 포함한 주문끼리 교착 상태가 생기지 않습니다.
 */
public interface StockLockManager {

    /**
     * @throws com.hhplus.orderengine.domain.exception.BusinessException 대기 시간 내 락을 얻지 못한 경우 (LOCK_TIMEOUT)
     */
    <T> T executeWithLocks(Collection<String> productIds, Supplier<T> action);
}
