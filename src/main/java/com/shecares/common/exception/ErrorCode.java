package com.shecares.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // === 공통 에러 코드 ===
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),

    // === 고객(Client) 도메인 에러 코드 ===
    CLIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Client not found"),

    // === 주문(Order) 도메인 에러 코드 ===
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.BAD_REQUEST, "Invalid order status transition"),

    // === 배송(Delivery) 도메인 에러 코드 ===
    DELIVERY_NOT_FOUND(HttpStatus.NOT_FOUND, "Delivery not found"),
    DELIVERY_ALREADY_EXISTS(HttpStatus.BAD_REQUEST, "Delivery already exists for this order"),
    INVALID_DELIVERY_STATUS(HttpStatus.BAD_REQUEST, "Invalid delivery status"),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "Invalid delivery status transition"),
    DUPLICATE_TRACKING_NUMBER(HttpStatus.BAD_REQUEST, "Tracking number already in use"),
    TRACKING_NUMBER_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "Could not allocate a tracking number"),
    DELIVERY_LOCKED(HttpStatus.CONFLICT, "Delivery is being updated by another request");

    private final HttpStatus status;
    private final String message;
}
