package com.shecares.delivery.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 배송 상태.
 *
 * <pre>
 * pending ──→ scheduled ──→ in_transit ──→ delivered
 *    │            │             │
 *    │            ↓             ↓
 *    └──────→ cancelled       failed ──→ scheduled / in_transit (재시도)
 *                 │
 *                 └──→ pending (재활성화)
 * </pre>
 *
 * <p>허용되는 전이는 {@code DeliveryValidator}의 전이 테이블에만 있다.
 * 이 enum은 저장/전송용 문자열 값만 알고 있다.</p>
 */
public enum DeliveryStatus {
    PENDING("pending"),
    SCHEDULED("scheduled"),
    IN_TRANSIT("in_transit"),
    DELIVERED("delivered"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    DeliveryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DELIVERED;
    }

    /**
     * 문자열 값으로 상태를 찾는다. 소문자 값과 정확히 일치해야 하며
     * 대소문자나 공백이 다르면 알 수 없는 상태로 본다.
     */
    public static Optional<DeliveryStatus> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst();
    }

    @JsonCreator
    public static DeliveryStatus fromValue(String value) {
        return find(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown delivery status: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
