package com.cafepos.order.controller;

import com.cafepos.common.dto.ApiResponse;
import com.cafepos.common.security.CurrentPrincipal;
import com.cafepos.common.security.Principal;
import com.cafepos.order.dto.CancellationDecisionRequest;
import com.cafepos.order.dto.CancellationRequest;
import com.cafepos.order.dto.CreateOrderRequest;
import com.cafepos.order.dto.OrderResponse;
import com.cafepos.order.dto.OrderStatusHistoryResponse;
import com.cafepos.order.dto.OrderSummaryResponse;
import com.cafepos.order.dto.PaymentStatusUpdateRequest;
import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.service.CancellationService;
import com.cafepos.order.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final CancellationService cancellationService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request,
                                                  @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(orderService.createOrder(request, principal));
    }

    @GetMapping
    public ApiResponse<Page<OrderSummaryResponse>> getOrders(
            @RequestParam(required = false) OrderStatus status,
            @PageableDefault(size = 20, sort = "id", direction = Sort.Direction.DESC) Pageable pageable,
            @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(orderService.getOrders(status, pageable, principal));
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderResponse> getOrder(@PathVariable Long id, @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(orderService.getOrder(id, principal));
    }

    @GetMapping("/{id}/history")
    public ApiResponse<List<OrderStatusHistoryResponse>> getStatusHistory(@PathVariable Long id,
                                                                          @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(orderService.getStatusHistory(id, principal));
    }

    @PatchMapping("/{id}/payment")
    public ApiResponse<OrderResponse> updatePaymentStatus(@PathVariable Long id,
                                                          @Valid @RequestBody PaymentStatusUpdateRequest request,
                                                          @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(orderService.updatePaymentStatus(id, request.paymentStatus(), principal));
    }

    @PostMapping("/{id}/cancellation")
    public ApiResponse<OrderResponse> requestCancellation(@PathVariable Long id,
                                                          @Valid @RequestBody CancellationRequest request,
                                                          @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(cancellationService.requestCancellation(id, principal, request.reason()));
    }

    @PostMapping("/{id}/cancellation/decision")
    public ApiResponse<OrderResponse> decideCancellation(@PathVariable Long id,
                                                         @Valid @RequestBody CancellationDecisionRequest request,
                                                         @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(cancellationService.decideCancellation(
                id, principal, request.approve(), request.notes()));
    }

    @GetMapping("/cancellations/pending")
    public ApiResponse<List<OrderSummaryResponse>> getPendingCancellations(@CurrentPrincipal Principal principal) {
        return ApiResponse.ok(cancellationService.getPendingCancellations(principal));
    }
}
