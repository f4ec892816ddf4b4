package com.cafepos.order.dto;

import com.cafepos.order.entity.Order;
import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.entity.PaymentMethod;
import com.cafepos.order.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
        Long id,
        String orderNumber,
        OrderStatus status,
        Long customerId,
        String customerName,
        String customerPhone,
        String customerEmail,
        List<OrderItemResponse> items,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal total,
        PaymentMethod paymentMethod,
        PaymentStatus paymentStatus,
        int loyaltyPointsEarned,
        int loyaltyPointsRedeemed,
        String notes,
        Long createdBy,
        Long cancellationRequestedBy,
        LocalDateTime cancellationRequestedAt,
        String cancellationReason,
        Long cancelledBy,
        LocalDateTime cancelledAt,
        LocalDateTime createdAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getStatus(),
                order.getCustomer() == null ? null : order.getCustomer().getId(),
                order.getCustomerName(),
                order.getCustomerPhone(),
                order.getCustomerEmail(),
                order.getItems().stream().map(OrderItemResponse::from).toList(),
                order.getSubtotal(),
                order.getTax(),
                order.getTotal(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getLoyaltyPointsEarned(),
                order.getLoyaltyPointsRedeemed(),
                order.getNotes(),
                order.getCreatedBy(),
                order.getCancellationRequestedBy(),
                order.getCancellationRequestedAt(),
                order.getCancellationReason(),
                order.getCancelledBy(),
                order.getCancelledAt(),
                order.getCreatedAt());
    }
}
