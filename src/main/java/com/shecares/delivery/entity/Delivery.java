package com.shecares.delivery.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 배송 엔티티 - 확정된 주문 하나에 배송 하나.
 *
 * <p>{@code status}는 {@link #changeStatus(DeliveryStatus, String)}로만 바뀌고,
 * 같은 호출에서 {@code statusHistory}에 항목이 추가된다.
 * 따라서 이력의 마지막 항목은 항상 현재 상태와 같다.
 * {@code orderId}, {@code clientId}, {@code trackingNumber}는 생성 후 바뀌지 않는다.</p>
 *
 * <p>{@code version}(낙관적 락)은 배송별 락을 거치지 않은 쓰기를 잡아낸다.</p>
 */
@Entity
@Table(name = "deliveries", uniqueConstraints = {
        @UniqueConstraint(name = Delivery.ORDER_ID_CONSTRAINT, columnNames = "orderId"),
        @UniqueConstraint(name = "uk_delivery_tracking_number", columnNames = "trackingNumber")
}, indexes = {
        @Index(name = "idx_delivery_status", columnList = "status"),
        @Index(name = "idx_delivery_client", columnList = "clientId"),
        @Index(name = "idx_delivery_created_at", columnList = "createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Delivery {

    public static final String ORDER_ID_CONSTRAINT = "uk_delivery_order_id";

    static final String CREATED_NOTE = "Delivery created";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "delivery_seq")
    @SequenceGenerator(name = "delivery_seq", sequenceName = "delivery_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false)
    private Long orderId;

    @Column(nullable = false, updatable = false)
    private Long clientId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "delivery_status_history", joinColumns = @JoinColumn(name = "delivery_id"))
    @OrderColumn(name = "seq")
    private List<DeliveryStatusHistory> statusHistory = new ArrayList<>();

    @Column(nullable = false, updatable = false, length = 20)
    private String trackingNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryMethod deliveryMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryPriority priority;

    private LocalDateTime scheduledDate;

    private String timeSlot;

    private String estimatedDeliveryTime;

    private LocalDateTime deliveredAt;

    @Embedded
    private DeliveryLocation deliveryLocation;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal deliveryFee;

    @Column(length = 1000)
    private String deliveryNotes;

    private String recipientName;

    private String recipientPhone;

    private String assigneeId;

    private String deliveryPersonnelName;

    private String deliveryPersonnelPhone;

    private String proofOfDelivery;

    private boolean signatureRequired;

    private boolean freeDelivery;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @Builder
    public Delivery(Long orderId, Long clientId, DeliveryStatus status, String trackingNumber,
                    DeliveryMethod deliveryMethod, DeliveryPriority priority,
                    LocalDateTime scheduledDate, String timeSlot, BigDecimal deliveryFee,
                    String recipientName, String recipientPhone, DeliveryLocation deliveryLocation,
                    String deliveryNotes, boolean signatureRequired, boolean freeDelivery) {
        this.orderId = orderId;
        this.clientId = clientId;
        this.status = status != null ? status : DeliveryStatus.PENDING;
        this.trackingNumber = trackingNumber;
        this.deliveryMethod = deliveryMethod != null ? deliveryMethod : DeliveryMethod.DELIVERY;
        this.priority = priority != null ? priority : DeliveryPriority.STANDARD;
        this.scheduledDate = scheduledDate;
        this.timeSlot = timeSlot;
        this.deliveryFee = deliveryFee != null ? deliveryFee : BigDecimal.ZERO;
        this.recipientName = recipientName;
        this.recipientPhone = recipientPhone;
        this.deliveryLocation = deliveryLocation;
        this.deliveryNotes = deliveryNotes;
        this.signatureRequired = signatureRequired;
        this.freeDelivery = freeDelivery;

        LocalDateTime now = LocalDateTime.now();
        this.statusHistory.add(new DeliveryStatusHistory(this.status, now, CREATED_NOTE));
        this.updatedAt = now;
    }

    /**
     * 상태를 바꾸고 이력에 기록한다.
     * 전이 검증은 호출하는 쪽(DeliveryWorkflowService)의 책임이다.
     */
    public void changeStatus(DeliveryStatus newStatus, String note) {
        LocalDateTime now = LocalDateTime.now();
        this.statusHistory.add(new DeliveryStatusHistory(newStatus, now, note));
        this.status = newStatus;
        if (newStatus == DeliveryStatus.DELIVERED) {
            this.deliveredAt = now;
        }
        this.updatedAt = now;
    }

    public void schedule(LocalDateTime scheduledDate, String timeSlot) {
        this.scheduledDate = scheduledDate;
        this.timeSlot = timeSlot;
        touch();
    }

    public void assign(String assigneeId, String personnelName, String personnelPhone) {
        this.assigneeId = assigneeId;
        this.deliveryPersonnelName = personnelName;
        this.deliveryPersonnelPhone = personnelPhone;
        touch();
    }

    public void recordProofOfDelivery(String proofOfDelivery) {
        this.proofOfDelivery = proofOfDelivery;
        touch();
    }

    public void updateDetails(DeliveryDetails details) {
        if (details.scheduledDate() != null) this.scheduledDate = details.scheduledDate();
        if (details.timeSlot() != null) this.timeSlot = details.timeSlot();
        if (details.deliveryFee() != null) this.deliveryFee = details.deliveryFee();
        if (details.recipientName() != null) this.recipientName = details.recipientName();
        if (details.recipientPhone() != null) this.recipientPhone = details.recipientPhone();
        if (details.deliveryLocation() != null) this.deliveryLocation = details.deliveryLocation();
        if (details.deliveryNotes() != null) this.deliveryNotes = details.deliveryNotes();
        if (details.deliveryMethod() != null) this.deliveryMethod = details.deliveryMethod();
        if (details.priority() != null) this.priority = details.priority();
        if (details.signatureRequired() != null) this.signatureRequired = details.signatureRequired();
        if (details.freeDelivery() != null) this.freeDelivery = details.freeDelivery();
        if (details.estimatedDeliveryTime() != null) this.estimatedDeliveryTime = details.estimatedDeliveryTime();
        touch();
    }

    public List<DeliveryStatusHistory> getStatusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    public DeliveryStatusHistory getLatestStatusEntry() {
        return statusHistory.get(statusHistory.size() - 1);
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
