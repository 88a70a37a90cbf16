package com.shecares.delivery.service;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import com.shecares.delivery.entity.DeliveryStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.shecares.delivery.entity.DeliveryStatus.*;

/**
 * 배송 검증 규칙 - 상태 전이 테이블과 생성/수정 입력 검증.
 *
 * <p>전이 규칙은 분기문이 아니라 테이블 데이터로 관리한다.
 * 아래 테이블에 없는 전이는 모두 거부되며, 같은 상태로의 전이도 포함된다.</p>
 */
@Component
public class DeliveryValidator {

    private static final Map<DeliveryStatus, Set<DeliveryStatus>> TRANSITIONS;

    static {
        Map<DeliveryStatus, Set<DeliveryStatus>> table = new EnumMap<>(DeliveryStatus.class);
        table.put(PENDING, Collections.unmodifiableSet(EnumSet.of(SCHEDULED, IN_TRANSIT, CANCELLED)));
        table.put(SCHEDULED, Collections.unmodifiableSet(EnumSet.of(IN_TRANSIT, CANCELLED)));
        table.put(IN_TRANSIT, Collections.unmodifiableSet(EnumSet.of(DELIVERED, FAILED)));
        table.put(DELIVERED, Collections.unmodifiableSet(EnumSet.noneOf(DeliveryStatus.class)));
        table.put(FAILED, Collections.unmodifiableSet(EnumSet.of(SCHEDULED, IN_TRANSIT)));
        table.put(CANCELLED, Collections.unmodifiableSet(EnumSet.of(PENDING)));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    /** 현재 상태에서 갈 수 있는 상태 목록. {@code null}이면 빈 집합. */
    public Set<DeliveryStatus> allowedTransitions(DeliveryStatus current) {
        if (current == null) {
            return Set.of();
        }
        return TRANSITIONS.get(current);
    }

    public boolean canTransition(DeliveryStatus current, DeliveryStatus next) {
        return current != null && next != null && TRANSITIONS.get(current).contains(next);
    }

    /**
     * 문자열 상태 간 전이 검증.
     *
     * <p>두 값 모두 알려진 상태 값이고 테이블에 있는 전이일 때만 통과한다.</p>
     *
     * @throws BusinessException {@link ErrorCode#INVALID_STATUS_TRANSITION}
     */
    public void validateStatusTransition(String currentStatus, String newStatus) {
        Optional<DeliveryStatus> current = DeliveryStatus.find(currentStatus);
        Optional<DeliveryStatus> next = DeliveryStatus.find(newStatus);
        if (current.isEmpty() || next.isEmpty() || !canTransition(current.get(), next.get())) {
            throw invalidTransition(currentStatus, newStatus);
        }
    }

    public void validateStatusTransition(DeliveryStatus currentStatus, DeliveryStatus newStatus) {
        if (!canTransition(currentStatus, newStatus)) {
            throw invalidTransition(String.valueOf(currentStatus), String.valueOf(newStatus));
        }
    }

    public void validateCreate(CreateDeliveryCommand command) {
        List<String> errors = new ArrayList<>();
        if (command.orderId() == null) {
            errors.add("Order ID is required");
        }
        checkFee(command.deliveryFee(), errors);
        checkScheduledDate(command.scheduledDate(), errors);
        throwIfAny("Delivery validation failed", errors);
    }

    public void validateUpdate(UpdateDeliveryCommand command) {
        List<String> errors = new ArrayList<>();
        if (command.orderId() != null) {
            errors.add("Order ID cannot be updated");
        }
        if (command.status() != null) {
            errors.add("Status can only be changed through a status update");
        }
        checkFee(command.deliveryFee(), errors);
        checkScheduledDate(command.scheduledDate(), errors);
        throwIfAny("Delivery update validation failed", errors);
    }

    public void validateScheduledDate(LocalDateTime scheduledDate) {
        if (scheduledDate == null || !scheduledDate.isAfter(LocalDateTime.now())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Scheduled date must be in the future");
        }
    }

    private void checkFee(BigDecimal fee, List<String> errors) {
        if (fee != null && fee.signum() < 0) {
            errors.add("Delivery fee must be a non-negative number");
        }
    }

    private void checkScheduledDate(LocalDateTime scheduledDate, List<String> errors) {
        if (scheduledDate != null && scheduledDate.isBefore(LocalDateTime.now())) {
            errors.add("Scheduled date cannot be in the past");
        }
    }

    private void throwIfAny(String summary, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, summary + ": " + String.join("; ", errors));
        }
    }

    private BusinessException invalidTransition(String from, String to) {
        return new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Invalid status transition from '%s' to '%s'", from, to));
    }
}
