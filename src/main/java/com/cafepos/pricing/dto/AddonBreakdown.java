package com.cafepos.pricing.dto;

import java.math.BigDecimal;

public record AddonBreakdown(
        Long addonId,
        String name,
        BigDecimal unitPrice,
        int quantity,
        BigDecimal subtotal
) {
}
