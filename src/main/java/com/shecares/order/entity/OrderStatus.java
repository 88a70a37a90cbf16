package com.shecares.order.entity;

public enum OrderStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED
}
