package com.cafepos.order.entity;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED
}
