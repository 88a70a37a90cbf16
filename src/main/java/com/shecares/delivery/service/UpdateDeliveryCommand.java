package com.shecares.delivery.service;

import com.shecares.delivery.entity.DeliveryDetails;
import com.shecares.delivery.entity.DeliveryLocation;
import com.shecares.delivery.entity.DeliveryMethod;
import com.shecares.delivery.entity.DeliveryPriority;
import com.shecares.delivery.entity.DeliveryStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 배송 상세 수정 요청.
 *
 * <p>{@code orderId}와 {@code status}는 거부하기 위해서만 받는다.
 * 식별자는 바뀌지 않고, 상태는 워크플로를 통해서만 바뀐다.</p>
 */
@Builder
public record UpdateDeliveryCommand(
        Long orderId,
        DeliveryStatus status,
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
) {

    public DeliveryDetails toDetails() {
        return DeliveryDetails.builder()
                .scheduledDate(scheduledDate)
                .timeSlot(timeSlot)
                .deliveryFee(deliveryFee)
                .recipientName(recipientName)
                .recipientPhone(recipientPhone)
                .deliveryLocation(deliveryLocation)
                .deliveryNotes(deliveryNotes)
                .deliveryMethod(deliveryMethod)
                .priority(priority)
                .signatureRequired(signatureRequired)
                .freeDelivery(freeDelivery)
                .estimatedDeliveryTime(estimatedDeliveryTime)
                .build();
    }
}
