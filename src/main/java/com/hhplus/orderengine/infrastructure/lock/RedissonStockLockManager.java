package com.hhplus.orderengine.infrastructure.lock;

import com.hhplus.orderengine.config.LockProperties;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.infrastructure.redis.RedisKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redisson 기반 상품별 분산 락
 *
 * 주문에 포함된 모든 상품의 RLock 을 MultiLock 으로 묶어 한 번에 획득합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lock", name = "type", havingValue = "REDISSON")
public class RedissonStockLockManager implements StockLockManager {

    private final RedissonClient redissonClient;
    private final LockProperties lockProperties;

    @Override
    public <T> T executeWithLocks(Collection<String> productIds, Supplier<T> action) {
        RLock[] locks = new TreeSet<>(productIds).stream()
                .map(productId -> redissonClient.getLock(RedisKeyGenerator.productStockLock(productId)))
                .toArray(RLock[]::new);
        RLock multiLock = redissonClient.getMultiLock(locks);

        boolean isLocked = false;
        try {
            isLocked = multiLock.tryLock(
                    lockProperties.getWaitTime(),
                    lockProperties.getLeaseTime(),
                    TimeUnit.MILLISECONDS
            );
            if (!isLocked) {
                log.warn("재고 분산 락 획득 실패: productIds={}", productIds);
                throw new BusinessException(ErrorCode.LOCK_TIMEOUT);
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_TIMEOUT, e);
        } finally {
            if (isLocked) {
                multiLock.unlock();
            }
        }
    }
}
