package com.hhplus.orderengine.config;

import com.hhplus.orderengine.infrastructure.lock.LockType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 재고 락 설정
 *
 * application.yml 의 lock.* 값을 읽어옴
 */
@Configuration
@ConfigurationProperties(prefix = "lock")
@Getter
@Setter
public class LockProperties {

    /**
     * 락 구현 (LOCAL / REDISSON)
     */
    private LockType type = LockType.LOCAL;

    /**
     * 락 획득 최대 대기 시간 (밀리초)
     */
    private long waitTime = 5000;

    /**
     * 분산 락 유지 시간 (밀리초, REDISSON 전용)
     */
    private long leaseTime = 3000;
}
