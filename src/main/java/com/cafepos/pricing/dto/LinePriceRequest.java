package com.cafepos.pricing.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * One order line to be priced. {@code quantity} defaults to 1 when omitted.
 */
public record LinePriceRequest(
        @NotNull Long menuItemId,
        Long variantId,
        List<@Valid AddonSelection> addons,
        @Min(1) @Max(100) Integer quantity
) {
    public LinePriceRequest {
        addons = addons == null ? List.of() : List.copyOf(addons);
    }

    public int quantityOrDefault() {
        return quantity == null ? 1 : quantity;
    }
}
