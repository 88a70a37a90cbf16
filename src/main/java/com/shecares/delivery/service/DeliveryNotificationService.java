package com.shecares.delivery.service;

import com.shecares.client.entity.Client;
import com.shecares.client.repository.ClientRepository;
import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryStatus;
import com.shecares.notification.service.EmailMessage;
import com.shecares.notification.service.NotificationSender;
import com.shecares.order.entity.Order;
import com.shecares.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 배송 상태 알림 - 고객에게 보여줄 상태에 도달하면 주문 고객에게 이메일을 보낸다.
 *
 * <p>템플릿이 없는 상태는 아무것도 보내지 않는다. 주문이나 고객이 없거나
 * 고객 이메일이 없는 경우도 오류가 아니다 (연락처가 없는 배송도 있다).
 * 발송 자체의 실패는 호출자에게 던지고, 호출자가 best-effort로 처리한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryNotificationService {

    private static final Map<DeliveryStatus, Template> TEMPLATES;

    static {
        Map<DeliveryStatus, Template> templates = new EnumMap<>(DeliveryStatus.class);
        templates.put(DeliveryStatus.SCHEDULED, new Template(
                "Your delivery is being processed",
                "Your order #%s is now being processed for delivery."));
        templates.put(DeliveryStatus.IN_TRANSIT, new Template(
                "Your delivery is on its way",
                "Good news! Your order #%s is now out for delivery."));
        templates.put(DeliveryStatus.DELIVERED, new Template(
                "Your order has been delivered",
                "Your order #%s has been delivered. Thank you for your business!"));
        templates.put(DeliveryStatus.FAILED, new Template(
                "Delivery attempt unsuccessful",
                "We were unable to deliver your order #%s. Our team will contact you soon."));
        TEMPLATES = Collections.unmodifiableMap(templates);
    }

    private final OrderRepository orderRepository;
    private final ClientRepository clientRepository;
    private final NotificationSender notificationSender;

    public void notifyStatusChange(Delivery delivery, DeliveryStatus newStatus) {
        Template template = TEMPLATES.get(newStatus);
        if (template == null) {
            return;
        }

        Optional<Order> order = orderRepository.findById(delivery.getOrderId());
        if (order.isEmpty()) {
            log.debug("Skipping notification, order not found: deliveryId={}, orderId={}",
                    delivery.getId(), delivery.getOrderId());
            return;
        }

        Optional<Client> client = clientRepository.findById(order.get().getClientId());
        if (client.isEmpty() || !client.get().hasEmail()) {
            log.debug("Skipping notification, no client email: deliveryId={}, clientId={}",
                    delivery.getId(), order.get().getClientId());
            return;
        }

        String orderNumber = order.get().getOrderNumber();
        notificationSender.sendEmail(new EmailMessage(
                client.get().getEmail(), template.subject(), template.body(orderNumber)));
        log.info("Delivery notification sent: deliveryId={}, status={}, orderNumber={}",
                delivery.getId(), newStatus, orderNumber);
    }

    private record Template(String subject, String bodyFormat) {

        String body(String orderNumber) {
            return String.format(bodyFormat, orderNumber);
        }
    }
}
