package com.cafepos.order.event;

import com.cafepos.order.entity.OrderStatus;

public record OrderStatusChangedEvent(
        Long orderId,
        String orderNumber,
        OrderStatus previousStatus,
        OrderStatus newStatus,
        Long changedBy,
        String reason
) {
}
