package com.cafepos.pricing.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record AddonSelection(
        @NotNull Long addonId,
        @NotNull @Min(1) Integer quantity
) {
}
