package com.cafepos.order.dto;

import com.cafepos.pricing.dto.AddonSelection;
import com.cafepos.pricing.dto.LinePriceRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record OrderItemRequest(
        @NotNull Long menuItemId,
        Long variantId,
        List<@Valid AddonSelection> addons,
        @NotNull @Min(1) @Max(100) Integer quantity,
        @Size(max = 500) String specialInstructions
) {
    public LinePriceRequest toLinePriceRequest() {
        return new LinePriceRequest(menuItemId, variantId, addons, quantity);
    }
}
