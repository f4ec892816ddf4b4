package com.cafepos.order.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CancellationDecisionRequest(
        @NotNull Boolean approve,
        @Size(max = 1000) String notes
) {
}
