package com.shecares.delivery.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 배송 상태 이력 한 건. {@link Delivery}가 추가만 하고 수정하지 않는다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryStatusHistory {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(length = 500)
    private String note;

    DeliveryStatusHistory(DeliveryStatus status, LocalDateTime timestamp, String note) {
        this.status = status;
        this.timestamp = timestamp;
        this.note = note;
    }
}
