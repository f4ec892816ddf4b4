package com.cafepos.order.event;

import java.math.BigDecimal;

public record OrderCreatedEvent(
        Long orderId,
        String orderNumber,
        BigDecimal total,
        Long customerId,
        int loyaltyPointsEarned,
        Long createdBy
) {
}
