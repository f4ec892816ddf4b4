package com.cafepos.order.dto;

import com.cafepos.order.entity.Order;
import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.entity.PaymentMethod;
import com.cafepos.order.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record OrderSummaryResponse(
        Long id,
        String orderNumber,
        OrderStatus status,
        String customerName,
        BigDecimal total,
        PaymentMethod paymentMethod,
        PaymentStatus paymentStatus,
        Long cancellationRequestedBy,
        String cancellationReason,
        LocalDateTime createdAt
) {
    public static OrderSummaryResponse from(Order order) {
        return new OrderSummaryResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getStatus(),
                order.getCustomerName(),
                order.getTotal(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getCancellationRequestedBy(),
                order.getCancellationReason(),
                order.getCreatedAt());
    }
}
