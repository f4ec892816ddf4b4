package com.cafepos.pricing.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Priced order. Lines keep the order of the request. Tax is always zero and
 * {@code total} always equals {@code subtotal}.
 */
public record OrderQuote(
        List<QuotedLine> lines,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal total
) {
}
