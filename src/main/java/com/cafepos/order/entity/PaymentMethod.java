package com.cafepos.order.entity;

public enum PaymentMethod {
    CASH,
    CARD,
    UPI,
    LOYALTY     // settled from the customer's point balance at creation
}
