package com.cafepos.pricing.dto;

import java.math.BigDecimal;

public record QuotedLine(
        PriceBreakdown breakdown,
        int quantity,
        BigDecimal lineTotal
) {
}
