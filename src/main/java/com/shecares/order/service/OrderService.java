package com.shecares.order.service;

import com.shecares.common.exception.BusinessException;
import com.shecares.common.exception.ErrorCode;
import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.service.CreateDeliveryCommand;
import com.shecares.delivery.service.DeliveryService;
import com.shecares.order.entity.Order;
import com.shecares.order.entity.OrderStatus;
import com.shecares.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    private final OrderRepository orderRepository;
    private final DeliveryService deliveryService;

    public Order getOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    /**
     * 대기 중인 주문을 확정하고 같은 트랜잭션에서 배송을 생성한다.
     * 배송 생성이 실패하면 주문 확정도 함께 롤백된다.
     *
     * @param deliveryDetails 수령인, 배송지, 일정 등 배송 정보 ({@code null} 가능)
     */
    @Transactional
    public Delivery confirmOrder(Long orderId, CreateDeliveryCommand deliveryDetails) {
        Order order = getOrder(orderId);

        if (order.getStatus() != OrderStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Only pending orders can be confirmed, order " + orderId + " is " + order.getStatus());
        }

        order.updateStatus(OrderStatus.CONFIRMED);

        CreateDeliveryCommand.CreateDeliveryCommandBuilder command = deliveryDetails != null
                ? deliveryDetails.toBuilder()
                : CreateDeliveryCommand.builder();
        command.orderId(order.getId()).clientId(order.getClientId());
        if (deliveryDetails == null || deliveryDetails.deliveryFee() == null) {
            command.deliveryFee(order.getDeliveryFee());
        }

        Delivery delivery = deliveryService.createDelivery(command.build());
        log.info("Order confirmed: orderId={}, orderNumber={}, deliveryId={}",
                order.getId(), order.getOrderNumber(), delivery.getId());
        return delivery;
    }
}
