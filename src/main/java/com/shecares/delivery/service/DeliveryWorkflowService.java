package com.shecares.delivery.service;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryDetails;
import com.shecares.delivery.entity.DeliveryStatus;
import com.shecares.delivery.event.DeliveryStatusUpdatedEvent;
import com.shecares.delivery.event.DeliveryUpdatedEvent;
import com.shecares.delivery.lock.DeliveryLockProvider;
import com.shecares.delivery.repository.DeliveryRepository;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.function.Consumer;

/**
 * 배송 상태 워크플로 - 이미 생성된 배송의 모든 변경이 여기를 거친다.
 *
 * <h3>상태 전이 흐름</h3>
 * <ol>
 *   <li>배송별 락 획득 ({@link DeliveryLockProvider})</li>
 *   <li>하나의 트랜잭션에서: 조회 → 전이 테이블 검증 → 이력 추가 → flush</li>
 *   <li>커밋 후 락 해제</li>
 *   <li>고객 알림 발송 (best-effort, 실패는 로그만 남김)</li>
 *   <li>{@link DeliveryStatusUpdatedEvent} 발행</li>
 * </ol>
 *
 * <p>락은 커밋이 끝날 때까지 유지되므로 같은 배송의 다음 요청은 항상 커밋된 상태를 읽는다.
 * 락이 트랜잭션 경계를 감싸야 하기 때문에 {@code @Transactional} 대신
 * {@link TransactionTemplate}으로 트랜잭션을 연다.</p>
 *
 * <h3>@Bulkhead</h3>
 * <p>상태를 바꾸는 메서드는 모두 {@code deliveryStatusUpdate} Bulkhead를 공유한다.
 * 락 대기 중인 요청이 몰려도 스레드 풀 전체가 묶이지 않도록 동시 실행 수를 제한한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryWorkflowService {

    private final DeliveryRepository deliveryRepository;
    private final DeliveryValidator deliveryValidator;
    private final DeliveryLockProvider deliveryLockProvider;
    private final DeliveryNotificationService deliveryNotificationService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    /**
     * 배송 상태 변경.
     *
     * @param note 이력 메모. {@code null}이면 "Status updated to &lt;상태&gt;"로 기록
     * @throws BusinessException 배송이 없으면 {@code DELIVERY_NOT_FOUND},
     *         허용되지 않은 전이면 {@code INVALID_STATUS_TRANSITION}
     */
    @Bulkhead(name = "deliveryStatusUpdate")
    public Delivery updateDeliveryStatus(Long deliveryId, DeliveryStatus newStatus, String note) {
        return transition(deliveryId, newStatus, note, delivery -> { });
    }

    /** 문자열 상태 값({@code "in_transit"} 등)으로 상태 변경. 알 수 없는 값은 {@code INVALID_DELIVERY_STATUS}. */
    @Bulkhead(name = "deliveryStatusUpdate")
    public Delivery updateDeliveryStatus(Long deliveryId, String newStatus, String note) {
        DeliveryStatus status = DeliveryStatus.find(newStatus)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_DELIVERY_STATUS,
                        "Invalid delivery status: '" + newStatus + "'"));
        return transition(deliveryId, status, note, delivery -> { });
    }

    /** 배송 일정과 시간대를 기록하고 {@code scheduled}로 전이. */
    @Bulkhead(name = "deliveryStatusUpdate")
    public Delivery scheduleDelivery(Long deliveryId, LocalDateTime scheduledDate, String timeSlot) {
        deliveryValidator.validateScheduledDate(scheduledDate);
        String note = timeSlot != null
                ? "Scheduled for " + scheduledDate + " (" + timeSlot + ")"
                : "Scheduled for " + scheduledDate;
        return transition(deliveryId, DeliveryStatus.SCHEDULED, note,
                delivery -> delivery.schedule(scheduledDate, timeSlot));
    }

    @Bulkhead(name = "deliveryStatusUpdate")
    public Delivery cancelDelivery(Long deliveryId, String reason) {
        return transition(deliveryId, DeliveryStatus.CANCELLED, reason, delivery -> { });
    }

    /** 배송 완료. 배송 증빙이 있으면 함께 기록한다. */
    @Bulkhead(name = "deliveryStatusUpdate")
    public Delivery completeDelivery(Long deliveryId, String proofOfDelivery, String note) {
        return transition(deliveryId, DeliveryStatus.DELIVERED, note, delivery -> {
            if (proofOfDelivery != null) {
                delivery.recordProofOfDelivery(proofOfDelivery);
            }
        });
    }

    /** 배송 상세 정보 수정. 상태와 식별 필드(주문 ID)는 바꿀 수 없다. */
    public Delivery updateDelivery(Long deliveryId, UpdateDeliveryCommand command) {
        deliveryValidator.validateUpdate(command);
        DeliveryDetails details = command.toDetails();

        Delivery updated = deliveryLockProvider.executeWithLock(deliveryId, () ->
                transactionTemplate.execute(tx -> {
                    Delivery delivery = findDelivery(deliveryId);
                    delivery.updateDetails(details);
                    return deliveryRepository.saveAndFlush(delivery);
                }));

        log.info("Delivery details updated: deliveryId={}", deliveryId);
        eventPublisher.publishEvent(new DeliveryUpdatedEvent(deliveryId, details, updated));
        return updated;
    }

    public Delivery assignDelivery(Long deliveryId, String assigneeId,
                                   String personnelName, String personnelPhone) {
        Delivery updated = deliveryLockProvider.executeWithLock(deliveryId, () ->
                transactionTemplate.execute(tx -> {
                    Delivery delivery = findDelivery(deliveryId);
                    delivery.assign(assigneeId, personnelName, personnelPhone);
                    return deliveryRepository.saveAndFlush(delivery);
                }));

        log.info("Delivery assigned: deliveryId={}, assigneeId={}", deliveryId, assigneeId);
        return updated;
    }

    private Delivery transition(Long deliveryId, DeliveryStatus newStatus, String note,
                                Consumer<Delivery> beforeTransition) {
        String historyNote = note != null ? note : "Status updated to " + newStatus.getValue();

        Delivery updated = deliveryLockProvider.executeWithLock(deliveryId, () ->
                transactionTemplate.execute(tx -> {
                    Delivery delivery = findDelivery(deliveryId);
                    DeliveryStatus previous = delivery.getStatus();

                    deliveryValidator.validateStatusTransition(previous, newStatus);

                    beforeTransition.accept(delivery);
                    delivery.changeStatus(newStatus, historyNote);
                    Delivery saved = deliveryRepository.saveAndFlush(delivery);

                    log.info("Delivery status changed: deliveryId={}, {} -> {}",
                            deliveryId, previous, newStatus);
                    return saved;
                }));

        notifyQuietly(updated, newStatus);
        eventPublisher.publishEvent(new DeliveryStatusUpdatedEvent(deliveryId, newStatus, note, updated));
        return updated;
    }

    private void notifyQuietly(Delivery delivery, DeliveryStatus newStatus) {
        try {
            deliveryNotificationService.notifyStatusChange(delivery, newStatus);
        } catch (Exception e) {
            // 상태 변경은 이미 커밋됨 - 알림 실패로 되돌리지 않는다
            log.error("Failed to send delivery notification: deliveryId={}, status={}",
                    delivery.getId(), newStatus, e);
        }
    }

    private Delivery findDelivery(Long deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND));
    }
}
