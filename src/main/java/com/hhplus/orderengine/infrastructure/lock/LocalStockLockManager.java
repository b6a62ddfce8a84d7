package com.hhplus.orderengine.infrastructure.lock;

import com.hhplus.orderengine.config.LockProperties;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * JVM 내부 상품별 락
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lock", name = "type", havingValue = "LOCAL", matchIfMissing = true)
public class LocalStockLockManager implements StockLockManager {

    private final LockProperties lockProperties;

    // 상품별 락 객체 (fair lock)
    private final ConcurrentHashMap<String, ReentrantLock> productLocks = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLocks(Collection<String> productIds, Supplier<T> action) {
        Deque<ReentrantLock> acquired = new ArrayDeque<>();
        try {
            for (String productId : new TreeSet<>(productIds)) {
                ReentrantLock lock = productLocks.computeIfAbsent(productId, k -> new ReentrantLock(true));
                if (!lock.tryLock(lockProperties.getWaitTime(), TimeUnit.MILLISECONDS)) {
                    log.warn("재고 락 획득 실패: productId={}, waitTime={}ms", productId, lockProperties.getWaitTime());
                    throw new BusinessException(ErrorCode.LOCK_TIMEOUT);
                }
                acquired.push(lock);
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_TIMEOUT, e);
        } finally {
            while (!acquired.isEmpty()) {
                acquired.pop().unlock();
            }
        }
    }
}
