package com.cafepos.pricing.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-unit price of a line: {@code unitPrice = basePrice + sum(addon subtotals)}.
 * The line quantity is applied by the order total aggregator.
 */
public record PriceBreakdown(
        Long menuItemId,
        String menuItemName,
        Long variantId,
        String variantName,
        BigDecimal basePrice,
        List<AddonBreakdown> addons,
        BigDecimal unitPrice
) {
}
