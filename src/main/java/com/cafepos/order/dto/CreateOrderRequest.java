package com.cafepos.order.dto;

import com.cafepos.order.entity.PaymentMethod;
import com.cafepos.order.entity.PaymentStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Either {@code customerId} links an existing customer, or phone/email find-or-create one.
 * With neither the order is a walk-in.
 */
public record CreateOrderRequest(
        @NotEmpty List<@Valid OrderItemRequest> items,
        Long customerId,
        @Size(min = 2, max = 100) String customerName,
        @Size(max = 20) String customerPhone,
        @Email String customerEmail,
        @NotNull PaymentMethod paymentMethod,
        PaymentStatus paymentStatus,
        @Size(max = 1000) String notes
) {
}
