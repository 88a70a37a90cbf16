package com.shecares.delivery.service;

import com.shecares.client.repository.ClientRepository;
import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryStatus;
import com.shecares.delivery.event.DeliveryCreatedEvent;
import com.shecares.delivery.repository.DeliveryRepository;
import com.shecares.order.entity.Order;
import com.shecares.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * 배송 생성과 조회.
 *
 * <p>이미 생성된 배송의 변경은 모두 {@link DeliveryWorkflowService}를 거친다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DeliveryService {

    private static final int MAX_TRACKING_NUMBER_ATTEMPTS = 10;

    private final DeliveryRepository deliveryRepository;
    private final OrderRepository orderRepository;
    private final ClientRepository clientRepository;
    private final DeliveryValidator deliveryValidator;
    private final TrackingNumberGenerator trackingNumberGenerator;
    private final DeliveryFeeCalculator deliveryFeeCalculator;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 주문에 대한 배송 생성.
     *
     * <h4>실행 흐름</h4>
     * <ol>
     *   <li>입력 검증 (주문 ID 필수, 배송비 0 이상, 일정은 과거 불가)</li>
     *   <li>주문 존재 확인, 주문당 배송 1건 확인</li>
     *   <li>추적번호 할당 후 저장 (초기 상태는 지정하지 않으면 pending)</li>
     *   <li>{@link DeliveryCreatedEvent} 발행</li>
     * </ol>
     *
     * <p>동시 생성은 order_id 유니크 제약이 최종 방어선이다.
     * 추적번호 충돌 같은 다른 제약 위반은 변환하지 않고 그대로 던진다.</p>
     *
     * @throws BusinessException 주문이 없으면 {@code ORDER_NOT_FOUND},
     *         이미 배송이 있으면 {@code DELIVERY_ALREADY_EXISTS}
     */
    @Transactional
    public Delivery createDelivery(CreateDeliveryCommand command) {
        deliveryValidator.validateCreate(command);

        Order order = orderRepository.findById(command.orderId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        if (deliveryRepository.existsByOrderId(order.getId())) {
            log.warn("Delivery already exists for order: orderId={}", order.getId());
            throw new BusinessException(ErrorCode.DELIVERY_ALREADY_EXISTS);
        }

        Delivery delivery = Delivery.builder()
                .orderId(order.getId())
                .clientId(command.clientId() != null ? command.clientId() : order.getClientId())
                .status(command.status())
                .trackingNumber(resolveTrackingNumber(command.trackingNumber()))
                .deliveryMethod(command.deliveryMethod())
                .priority(command.priority())
                .scheduledDate(command.scheduledDate())
                .timeSlot(command.timeSlot())
                .deliveryFee(command.deliveryFee())
                .recipientName(command.recipientName())
                .recipientPhone(command.recipientPhone())
                .deliveryLocation(command.deliveryLocation())
                .deliveryNotes(command.deliveryNotes())
                .signatureRequired(command.signatureRequired())
                .freeDelivery(command.freeDelivery())
                .build();

        try {
            delivery = deliveryRepository.saveAndFlush(delivery);
        } catch (DataIntegrityViolationException e) {
            // 같은 주문에 대한 동시 생성에서 진 경우만 중복 배송으로 변환, 그 외 제약 위반은 그대로 전파
            if (!violates(e, Delivery.ORDER_ID_CONSTRAINT)) {
                throw e;
            }
            log.warn("Duplicate delivery rejected by database: orderId={}", order.getId());
            throw new BusinessException(ErrorCode.DELIVERY_ALREADY_EXISTS);
        }

        log.info("Delivery created: deliveryId={}, orderId={}, trackingNumber={}, status={}",
                delivery.getId(), order.getId(), delivery.getTrackingNumber(), delivery.getStatus());

        eventPublisher.publishEvent(new DeliveryCreatedEvent(delivery.getId(), order.getId(), delivery));
        return delivery;
    }

    public Delivery getDelivery(Long deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND));
    }

    public Delivery getDeliveryByOrderId(Long orderId) {
        return deliveryRepository.findByOrderId(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND,
                        "Delivery not found for order " + orderId));
    }

    public Delivery getDeliveryByTrackingNumber(String trackingNumber) {
        return deliveryRepository.findByTrackingNumber(trackingNumber)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND,
                        "Delivery not found for tracking number " + trackingNumber));
    }

    public Page<Delivery> getDeliveries(Pageable pageable) {
        return deliveryRepository.findAll(pageable);
    }

    public Page<Delivery> getDeliveriesByClient(Long clientId, Pageable pageable) {
        if (!clientRepository.existsById(clientId)) {
            throw new BusinessException(ErrorCode.CLIENT_NOT_FOUND);
        }
        return deliveryRepository.findByClientId(clientId, pageable);
    }

    public Page<Delivery> getDeliveriesByStatus(DeliveryStatus status, Pageable pageable) {
        return deliveryRepository.findByStatus(status, pageable);
    }

    public Page<Delivery> getPendingDeliveries(Pageable pageable) {
        return getDeliveriesByStatus(DeliveryStatus.PENDING, pageable);
    }

    /** 배송 일정이 {@code [from, to]} 구간에 있는 배송. */
    public List<Delivery> getDeliveriesByDateRange(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start date must not be after end date");
        }
        return deliveryRepository.findByScheduledDateBetweenOrderByScheduledDateAsc(from, to);
    }

    /** 상태별 건수. 두 날짜가 모두 있으면 그 기간에 생성된 배송만 센다. */
    public DeliveryStats getStats(LocalDateTime from, LocalDateTime to) {
        if (from != null && to != null) {
            return DeliveryStats.from(deliveryRepository.countGroupedByStatusCreatedBetween(from, to));
        }
        return DeliveryStats.from(deliveryRepository.countGroupedByStatus());
    }

    public BigDecimal calculateDeliveryFee(FeeQuote quote) {
        return deliveryFeeCalculator.calculate(quote);
    }

    private static boolean violates(DataIntegrityViolationException e, String constraintName) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String violated = ((ConstraintViolationException) cause).getConstraintName();
                // H2는 "PUBLIC.UK_..._INDEX_x" 형태로 이름을 돌려준다
                if (violated != null && violated.toLowerCase(Locale.ROOT).contains(constraintName)) {
                    return true;
                }
            }
        }
        return false;
    }

    private String resolveTrackingNumber(String requested) {
        if (requested != null && !requested.isBlank()) {
            if (deliveryRepository.existsByTrackingNumber(requested)) {
                throw new BusinessException(ErrorCode.DUPLICATE_TRACKING_NUMBER);
            }
            return requested;
        }
        for (int attempt = 0; attempt < MAX_TRACKING_NUMBER_ATTEMPTS; attempt++) {
            String candidate = trackingNumberGenerator.generate();
            if (!deliveryRepository.existsByTrackingNumber(candidate)) {
                return candidate;
            }
        }
        log.error("No free tracking number after {} attempts", MAX_TRACKING_NUMBER_ATTEMPTS);
        throw new BusinessException(ErrorCode.TRACKING_NUMBER_UNAVAILABLE);
    }
}
