package com.hhplus.orderengine.infrastructure.lock;

/**
 * 재고 락 구현 타입
 */
public enum LockType {
    /**
     * JVM 내부 상품별 ReentrantLock
     * - 단일 인스턴스 배포용 (기본값)
     */
    LOCAL,

    /**
     * Redisson RLock (MultiLock)
     * - 여러 인스턴스가 같은 DB를 공유할 때 사용
     */
    REDISSON
}
