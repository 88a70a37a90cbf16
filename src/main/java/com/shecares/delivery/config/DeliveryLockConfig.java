package com.shecares.delivery.config;

import com.shecares.delivery.lock.DeliveryLockProvider;
import com.shecares.delivery.lock.LocalDeliveryLockProvider;
import com.shecares.delivery.lock.RedissonDeliveryLockProvider;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 배송별 락 구현 선택.
 *
 * <p>여러 인스턴스가 DB를 공유하면 Redisson 분산 락({@code shecares.delivery.lock.mode=redis}),
 * 그 외에는 프로세스 내 락을 사용한다.</p>
 */
@Configuration
public class DeliveryLockConfig {

    @Bean
    @ConditionalOnProperty(name = "shecares.delivery.lock.mode", havingValue = "redis")
    public DeliveryLockProvider redissonDeliveryLockProvider(
            RedissonClient redissonClient,
            @Value("${shecares.delivery.lock.wait-seconds:5}") long waitSeconds) {
        return new RedissonDeliveryLockProvider(redissonClient, waitSeconds);
    }

    @Bean
    @ConditionalOnProperty(name = "shecares.delivery.lock.mode", havingValue = "local", matchIfMissing = true)
    public DeliveryLockProvider localDeliveryLockProvider(
            @Value("${shecares.delivery.lock.wait-seconds:5}") long waitSeconds) {
        return new LocalDeliveryLockProvider(waitSeconds);
    }
}
