package com.shecares.delivery.entity;

public enum DeliveryMethod {
    PICKUP,
    DELIVERY
}
