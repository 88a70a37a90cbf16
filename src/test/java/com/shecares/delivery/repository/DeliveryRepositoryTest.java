package com.shecares.delivery.repository;

import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryLocation;
import com.shecares.delivery.entity.DeliveryStatus;
import com.shecares.delivery.entity.DeliveryStatusHistory;
import com.shecares.delivery.repository.DeliveryRepository.StatusCount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@ActiveProfiles("test")
class DeliveryRepositoryTest {

    @Autowired
    private DeliveryRepository deliveryRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Delivery newDelivery(Long orderId, String trackingNumber) {
        return Delivery.builder()
                .orderId(orderId)
                .clientId(7L)
                .trackingNumber(trackingNumber)
                .deliveryLocation(DeliveryLocation.builder()
                        .street("12 Allen Avenue")
                        .city("Ikeja")
                        .state("Lagos")
                        .build())
                .build();
    }

    @Test
    @DisplayName("상태 이력은 추가한 순서대로 저장되고 다시 읽힘")
    void statusHistory_PersistsInOrder() {
        Delivery delivery = deliveryRepository.saveAndFlush(newDelivery(1L, "DEL-20260101-0001"));
        delivery.changeStatus(DeliveryStatus.SCHEDULED, "Booked");
        delivery.changeStatus(DeliveryStatus.IN_TRANSIT, "Picked up");
        deliveryRepository.saveAndFlush(delivery);
        entityManager.clear();

        Delivery reloaded = deliveryRepository.findByTrackingNumber("DEL-20260101-0001").orElseThrow();

        assertThat(reloaded.getStatus()).isEqualTo(DeliveryStatus.IN_TRANSIT);
        assertThat(reloaded.getStatusHistory())
                .extracting(DeliveryStatusHistory::getStatus)
                .containsExactly(DeliveryStatus.PENDING, DeliveryStatus.SCHEDULED, DeliveryStatus.IN_TRANSIT);
        assertThat(reloaded.getStatusHistory())
                .extracting(DeliveryStatusHistory::getNote)
                .containsExactly("Delivery created", "Booked", "Picked up");
        assertThat(reloaded.getDeliveryLocation().getCountry()).isEqualTo("Nigeria");
        assertThat(reloaded.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("같은 주문에 두 번째 배송은 유니크 제약으로 거부")
    void orderId_IsUnique() {
        deliveryRepository.saveAndFlush(newDelivery(1L, "DEL-20260101-0001"));

        assertThatThrownBy(() -> deliveryRepository.saveAndFlush(newDelivery(1L, "DEL-20260101-0002")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("주문 ID 로 조회와 존재 여부 확인")
    void findByOrderId() {
        deliveryRepository.saveAndFlush(newDelivery(5L, "DEL-20260101-0005"));

        assertThat(deliveryRepository.existsByOrderId(5L)).isTrue();
        assertThat(deliveryRepository.existsByOrderId(6L)).isFalse();
        assertThat(deliveryRepository.findByOrderId(5L)).isPresent();
    }

    @Test
    @DisplayName("상태별 건수 집계")
    void countGroupedByStatus() {
        deliveryRepository.save(newDelivery(1L, "DEL-20260101-0001"));
        deliveryRepository.save(newDelivery(2L, "DEL-20260101-0002"));
        Delivery moving = newDelivery(3L, "DEL-20260101-0003");
        moving.changeStatus(DeliveryStatus.IN_TRANSIT, null);
        deliveryRepository.save(moving);
        deliveryRepository.flush();

        List<StatusCount> counts = deliveryRepository.countGroupedByStatus();

        assertThat(counts)
                .extracting(StatusCount::getStatus, StatusCount::getTotal)
                .containsExactlyInAnyOrder(
                        tuple(DeliveryStatus.PENDING, 2L),
                        tuple(DeliveryStatus.IN_TRANSIT, 1L));
    }

    @Test
    @DisplayName("일정 기간 조회는 일정 순으로 정렬")
    void findByScheduledDateBetween() {
        LocalDateTime base = LocalDateTime.now().plusDays(1);
        Delivery later = newDelivery(1L, "DEL-20260101-0001");
        later.schedule(base.plusHours(5), null);
        Delivery earlier = newDelivery(2L, "DEL-20260101-0002");
        earlier.schedule(base.plusHours(1), null);
        Delivery outside = newDelivery(3L, "DEL-20260101-0003");
        outside.schedule(base.plusDays(10), null);
        deliveryRepository.saveAllAndFlush(List.of(later, earlier, outside));

        List<Delivery> result = deliveryRepository
                .findByScheduledDateBetweenOrderByScheduledDateAsc(base, base.plusDays(1));

        assertThat(result).extracting(Delivery::getOrderId).containsExactly(2L, 1L);
    }
}
