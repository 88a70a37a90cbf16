package com.shecares.delivery.entity;

public enum DeliveryPriority {
    STANDARD,
    EXPRESS,
    PRIORITY
}
