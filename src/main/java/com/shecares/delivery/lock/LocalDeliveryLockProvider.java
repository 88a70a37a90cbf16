package com.shecares.delivery.lock;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 단일 인스턴스 배포용 프로세스 내 배송별 락.
 *
 * <p>키마다 사용 중인 스레드 수를 세고, 0이 되면 맵에서 제거한다.
 * 카운트는 키 단위로 원자적인 {@code compute} 호출 안에서만 바뀐다.</p>
 */
@Slf4j
public class LocalDeliveryLockProvider implements DeliveryLockProvider {

    private final ConcurrentHashMap<Long, KeyedLock> locks = new ConcurrentHashMap<>();
    private final long waitSeconds;

    public LocalDeliveryLockProvider(long waitSeconds) {
        this.waitSeconds = waitSeconds;
    }

    @Override
    public <T> T executeWithLock(Long deliveryId, Supplier<T> action) {
        KeyedLock keyedLock = locks.compute(deliveryId, (id, existing) -> {
            KeyedLock entry = existing != null ? existing : new KeyedLock();
            entry.users++;
            return entry;
        });

        try {
            if (!keyedLock.lock.tryLock(waitSeconds, TimeUnit.SECONDS)) {
                log.warn("Failed to acquire delivery lock: deliveryId={}", deliveryId);
                throw new BusinessException(ErrorCode.DELIVERY_LOCKED);
            }
            try {
                return action.get();
            } finally {
                keyedLock.lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.DELIVERY_LOCKED,
                    "Interrupted while waiting for delivery " + deliveryId);
        } finally {
            locks.computeIfPresent(deliveryId, (id, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class KeyedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
