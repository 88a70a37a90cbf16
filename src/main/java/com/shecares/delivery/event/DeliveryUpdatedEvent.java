package com.shecares.delivery.event;

import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryDetails;

public record DeliveryUpdatedEvent(Long deliveryId, DeliveryDetails updates, Delivery delivery) {}
