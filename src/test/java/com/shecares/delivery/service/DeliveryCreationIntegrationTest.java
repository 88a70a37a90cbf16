package com.shecares.delivery.service;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.repository.DeliveryRepository;
import com.shecares.notification.service.NotificationSender;
import com.shecares.order.entity.Order;
import com.shecares.order.repository.OrderRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.doReturn;

/**
 * H2 위에서 유니크 제약 위반이 어떤 오류로 보고되는지 확인한다.
 * 애플리케이션 수준 중복 검사를 우회해 동시 생성 경합을 재현한다.
 */
@SpringBootTest
@ActiveProfiles("test")
class DeliveryCreationIntegrationTest {

    @Autowired
    private DeliveryService deliveryService;
    @Autowired
    private OrderRepository orderRepository;

    @SpyBean
    private DeliveryRepository deliveryRepository;
    @MockBean
    private TrackingNumberGenerator trackingNumberGenerator;
    @MockBean
    private NotificationSender notificationSender;

    @AfterEach
    void tearDown() {
        deliveryRepository.deleteAll();
        orderRepository.deleteAll();
    }

    private Order saveOrder(String orderNumber) {
        return orderRepository.save(Order.builder()
                .orderNumber(orderNumber)
                .clientId(7L)
                .totalAmount(BigDecimal.valueOf(12000))
                .build());
    }

    @Test
    @DisplayName("다른 주문끼리 추적번호가 충돌하면 중복 배송이 아니라 무결성 오류로 전파")
    void trackingNumberClash_BetweenDifferentOrders_IsNotDuplicateDelivery() {
        Order first = saveOrder("ORD-3001");
        Order second = saveOrder("ORD-3002");
        given(trackingNumberGenerator.generate()).willReturn("DEL-20260101-1234");
        doReturn(false).when(deliveryRepository).existsByTrackingNumber(anyString());

        deliveryService.createDelivery(CreateDeliveryCommand.builder().orderId(first.getId()).build());

        assertThatThrownBy(() -> deliveryService.createDelivery(
                CreateDeliveryCommand.builder().orderId(second.getId()).build()))
                .isInstanceOf(DataIntegrityViolationException.class)
                .isNotInstanceOf(BusinessException.class);
        assertThat(deliveryRepository.findByOrderId(second.getId())).isEmpty();
    }

    @Test
    @DisplayName("같은 주문의 동시 생성은 주문 유니크 제약에서 DELIVERY_ALREADY_EXISTS")
    void sameOrderRace_IsReportedAsDuplicateDelivery() {
        Order order = saveOrder("ORD-3003");
        given(trackingNumberGenerator.generate()).willReturn("DEL-20260101-1111", "DEL-20260101-2222");

        Delivery created = deliveryService.createDelivery(
                CreateDeliveryCommand.builder().orderId(order.getId()).build());
        // 경합에서 진 요청은 아직 기존 배송을 보지 못한 상태
        doReturn(false).when(deliveryRepository).existsByOrderId(anyLong());

        assertThatThrownBy(() -> deliveryService.createDelivery(
                CreateDeliveryCommand.builder().orderId(order.getId()).build()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.DELIVERY_ALREADY_EXISTS);
        assertThat(deliveryRepository.findByOrderId(order.getId()))
                .get()
                .extracting(Delivery::getId)
                .isEqualTo(created.getId());
    }
}
