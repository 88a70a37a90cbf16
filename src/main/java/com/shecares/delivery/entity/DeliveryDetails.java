package com.shecares.delivery.entity;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 생성 후 바뀔 수 있는 배송 상세 정보. {@code null}인 항목은 기존 값을 유지한다.
 */
@Builder
public record DeliveryDetails(
        LocalDateTime scheduledDate,
        String timeSlot,
        BigDecimal deliveryFee,
        String recipientName,
        String recipientPhone,
        DeliveryLocation deliveryLocation,
        String deliveryNotes,
        DeliveryMethod deliveryMethod,
        DeliveryPriority priority,
        Boolean signatureRequired,
        Boolean freeDelivery,
        String estimatedDeliveryTime
) {}
