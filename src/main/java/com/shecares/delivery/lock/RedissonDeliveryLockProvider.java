package com.shecares.delivery.lock;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis 기반 배송별 분산 락 - 모든 백오피스 인스턴스가 같은 락을 공유한다.
 *
 * <p>{@code tryLock}에 lease 시간을 주지 않으므로 Redisson watchdog이
 * {@code unlock()} 전까지 락을 연장한다. 고정 TTL은 트랜잭션 커밋 전에 만료되어
 * 다른 요청이 커밋 전 상태를 읽게 만들 수 있다.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class RedissonDeliveryLockProvider implements DeliveryLockProvider {

    private static final String LOCK_KEY_PREFIX = "lock:delivery:";

    private final RedissonClient redissonClient;
    private final long waitSeconds;

    @Override
    public <T> T executeWithLock(Long deliveryId, Supplier<T> action) {
        RLock lock = redissonClient.getLock(LOCK_KEY_PREFIX + deliveryId);

        boolean acquired;
        try {
            acquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.DELIVERY_LOCKED,
                    "Interrupted while waiting for delivery " + deliveryId);
        }

        if (!acquired) {
            log.warn("Failed to acquire delivery lock: deliveryId={}", deliveryId);
            throw new BusinessException(ErrorCode.DELIVERY_LOCKED);
        }

        try {
            return action.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
