package com.shecares.delivery.event;

import com.shecares.delivery.entity.Delivery;

/** Published after a delivery has been stored for an order. */
public record DeliveryCreatedEvent(Long deliveryId, Long orderId, Delivery delivery) {}
