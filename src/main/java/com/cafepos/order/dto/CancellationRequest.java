package com.cafepos.order.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CancellationRequest(
        @NotBlank @Size(min = 5, max = 500) String reason
) {
}
