package com.hhplus.orderengine.infrastructure.redis;

/**
 * Redis 키 생성 유틸리티 클래스
 *
 * 형식: {type}:{domain}:{usecase}:{action}:{resource}
 *
 * 예시:
 * - lock:product:adjustStock:stock:3f2c...   (상품 재고 변경 락)
 */
public class RedisKeyGenerator {

    private RedisKeyGenerator() {
    }

    public static String lockKey(String domain, String usecase, String action, String resource) {
        return String.format("lock:%s:%s:%s:%s", domain, usecase, action, resource);
    }

    /**
     * 상품 재고 변경 락 키
     *
     * 주문 커밋, 주문 취소, 관리자 재고 조정이 모두 같은 키를 사용해야
     * 같은 상품에 대한 재고 변경이 직렬화됩니다.
     *
     * @param productId 상품 ID
     * @return lock:product:adjustStock:stock:{productId}
     */
    public static String productStockLock(String productId) {
        return lockKey("product", "adjustStock", "stock", productId);
    }
}
