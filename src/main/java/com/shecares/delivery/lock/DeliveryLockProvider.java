package com.shecares.delivery.lock;

import java.util.function.Supplier;

/**
 * 배송 하나에 대한 작업을 직렬화하는 락. 서로 다른 배송 ID끼리는 기다리지 않는다.
 */
public interface DeliveryLockProvider {

    /**
     * {@code deliveryId}의 락을 잡은 상태로 {@code action}을 실행한다.
     *
     * @throws com.shecares.common.exception.BusinessException 대기 시간 안에 락을
     *         얻지 못하면 {@code DELIVERY_LOCKED}
     */
    <T> T executeWithLock(Long deliveryId, Supplier<T> action);
}
