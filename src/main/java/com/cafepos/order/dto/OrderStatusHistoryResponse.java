package com.cafepos.order.dto;

import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.entity.OrderStatusHistory;

import java.time.LocalDateTime;

public record OrderStatusHistoryResponse(
        Long id,
        OrderStatus previousStatus,
        OrderStatus newStatus,
        Long changedBy,
        String reason,
        LocalDateTime createdAt
) {
    public static OrderStatusHistoryResponse from(OrderStatusHistory history) {
        return new OrderStatusHistoryResponse(history.getId(), history.getPreviousStatus(),
                history.getNewStatus(), history.getChangedBy(), history.getReason(), history.getCreatedAt());
    }
}
