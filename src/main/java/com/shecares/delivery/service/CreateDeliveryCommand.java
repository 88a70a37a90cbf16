package com.shecares.delivery.service;

import com.shecares.delivery.entity.DeliveryLocation;
import com.shecares.delivery.entity.DeliveryMethod;
import com.shecares.delivery.entity.DeliveryPriority;
import com.shecares.delivery.entity.DeliveryStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 배송 생성 요청.
 *
 * <p>{@code orderId}만 필수다. {@code status}는 기본 pending,
 * {@code clientId}는 주문의 고객, {@code trackingNumber}는 자동 생성 값이 기본이다.</p>
 */
@Builder(toBuilder = true)
public record CreateDeliveryCommand(
        Long orderId,
        Long clientId,
        DeliveryStatus status,
        String trackingNumber,
        DeliveryMethod deliveryMethod,
        DeliveryPriority priority,
        LocalDateTime scheduledDate,
        String timeSlot,
        BigDecimal deliveryFee,
        String recipientName,
        String recipientPhone,
        DeliveryLocation deliveryLocation,
        String deliveryNotes,
        boolean signatureRequired,
        boolean freeDelivery
) {}
