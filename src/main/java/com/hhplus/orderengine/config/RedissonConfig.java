package com.hhplus.orderengine.config;

import com.hhplus.orderengine.config.properties.RedisProperties;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 클라이언트 설정
 *
 * lock.type=REDISSON 일 때만 생성됩니다. 기본(LOCAL) 구성에서는 Redis 연결이 필요 없습니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
@ConditionalOnProperty(prefix = "lock", name = "type", havingValue = "REDISSON")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redisProperties.address());

        log.info("Redisson 클라이언트 초기화 - address: {}", redisProperties.address());
        return Redisson.create(config);
    }
}
