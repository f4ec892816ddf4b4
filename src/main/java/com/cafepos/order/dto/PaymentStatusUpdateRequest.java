package com.cafepos.order.dto;

import com.cafepos.order.entity.PaymentStatus;
import jakarta.validation.constraints.NotNull;

public record PaymentStatusUpdateRequest(@NotNull PaymentStatus paymentStatus) {
}
