package com.shecares.delivery.lock;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedissonDeliveryLockProviderTest {

    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RLock lock;

    private RedissonDeliveryLockProvider lockProvider;

    @BeforeEach
    void setUp() {
        lockProvider = new RedissonDeliveryLockProvider(redissonClient, 3);
        given(redissonClient.getLock("lock:delivery:42")).willReturn(lock);
    }

    @Test
    @DisplayName("잠금 획득 후 작업 실행, 끝나면 해제")
    void acquired_RunsAndUnlocks() throws InterruptedException {
        given(lock.tryLock(3, TimeUnit.SECONDS)).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        String result = lockProvider.executeWithLock(42L, () -> "done");

        assertThat(result).isEqualTo("done");
        verify(lock).unlock();
    }

    @Test
    @DisplayName("대기 시간 초과 시 DELIVERY_LOCKED, 작업은 실행 안 됨")
    void notAcquired_ThrowsLocked() throws InterruptedException {
        given(lock.tryLock(3, TimeUnit.SECONDS)).willReturn(false);

        assertThatThrownBy(() -> lockProvider.executeWithLock(42L, () -> {
            throw new AssertionError("must not run");
        }))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.DELIVERY_LOCKED);
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("작업이 실패해도 잠금 해제")
    void actionFails_StillUnlocks() throws InterruptedException {
        given(lock.tryLock(3, TimeUnit.SECONDS)).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        assertThatThrownBy(() -> lockProvider.executeWithLock(42L, () -> {
            throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION);
        })).isInstanceOf(BusinessException.class);

        verify(lock).unlock();
    }
}
