package com.cafepos.pricing.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record OrderQuoteRequest(
        @NotEmpty List<@Valid LinePriceRequest> items
) {
}
