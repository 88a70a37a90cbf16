package com.shecares.delivery.event;

import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryStatus;

/**
 * 상태 전이가 커밋된 뒤 발행되는 이벤트.
 * {@code note}는 호출자가 넘긴 메모이며, 기본 이력 메모를 쓴 경우 {@code null}이다.
 */
public record DeliveryStatusUpdatedEvent(
        Long deliveryId,
        DeliveryStatus newStatus,
        String note,
        Delivery delivery
) {}
