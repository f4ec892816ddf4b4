package com.cafepos.pricing.controller;

import com.cafepos.common.dto.ApiResponse;
import com.cafepos.pricing.dto.LinePriceRequest;
import com.cafepos.pricing.dto.OrderQuote;
import com.cafepos.pricing.dto.OrderQuoteRequest;
import com.cafepos.pricing.dto.PriceBreakdown;
import com.cafepos.pricing.service.OrderTotalAggregator;
import com.cafepos.pricing.service.PriceResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Checkout price previews. Uses the same resolver as order creation.
 */
@RestController
@RequestMapping("/api/menu")
@RequiredArgsConstructor
public class PricingController {

    private final PriceResolver priceResolver;
    private final OrderTotalAggregator orderTotalAggregator;

    @PostMapping("/calculate-price")
    public ApiResponse<PriceBreakdown> calculatePrice(@Valid @RequestBody LinePriceRequest request) {
        return ApiResponse.ok(priceResolver.calculateLinePrice(request));
    }

    @PostMapping("/calculate-order")
    public ApiResponse<OrderQuote> calculateOrder(@Valid @RequestBody OrderQuoteRequest request) {
        return ApiResponse.ok(orderTotalAggregator.aggregate(request.items()));
    }
}
