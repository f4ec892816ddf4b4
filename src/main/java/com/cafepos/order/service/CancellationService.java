package com.cafepos.order.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.common.security.Principal;
import com.cafepos.common.security.Role;
import com.cafepos.customer.service.CustomerService;
import com.cafepos.order.dto.OrderResponse;
import com.cafepos.order.dto.OrderSummaryResponse;
import com.cafepos.order.entity.Order;
import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.entity.OrderStatusHistory;
import com.cafepos.order.event.OrderStatusChangedEvent;
import com.cafepos.order.repository.OrderRepository;
import com.cafepos.order.repository.OrderStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Two-step cancellation: a manager or admin requests, an admin approves or rejects.
 *
 * <p>Every step locks the order row, re-checks its status under the lock, records a history
 * row and, on approval, reverses the customer aggregates, all in the same transaction.
 * A decision made against a stale view of the order fails with INVALID_ORDER_STATUS.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CancellationService {

    static final int MIN_REASON_LENGTH = 5;
    static final int MAX_REASON_LENGTH = 500;

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository orderStatusHistoryRepository;
    private final CustomerService customerService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public OrderResponse requestCancellation(Long orderId, Principal principal, String reason) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        String validReason = validateReason(reason);

        Order order = lockOrder(orderId);
        OrderStatus previous = order.getStatus();
        order.requestCancellation(principal.userId(), validReason);
        recordTransition(order, previous, principal, validReason);

        log.info("Cancellation requested: orderNumber={}, by={}", order.getOrderNumber(), principal.userId());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse decideCancellation(Long orderId, Principal principal, boolean approve, String notes) {
        Principal.require(principal).requireAnyRole(Role.ADMIN);

        Order order = lockOrder(orderId);
        OrderStatus previous = order.getStatus();
        if (approve) {
            order.approveCancellation(principal.userId());
            if (order.getCustomer() != null) {
                customerService.reverseOrder(order.getCustomer().getId(), order.getTotal(),
                        order.getLoyaltyPointsEarned(), order.getLoyaltyPointsRedeemed());
            }
        } else {
            order.rejectCancellation();
        }
        String historyReason = notes != null && !notes.isBlank()
                ? notes.trim()
                : (approve ? "Cancellation approved" : "Cancellation rejected");
        recordTransition(order, previous, principal, historyReason);

        log.info("Cancellation {}: orderNumber={}, by={}",
                approve ? "approved" : "rejected", order.getOrderNumber(), principal.userId());
        return OrderResponse.from(order);
    }

    public List<OrderSummaryResponse> getPendingCancellations(Principal principal) {
        Principal.require(principal).requireAnyRole(Role.ADMIN);
        return orderRepository.findByStatusOrderByCancellationRequestedAtAsc(OrderStatus.PENDING_CANCELLATION)
                .stream()
                .map(OrderSummaryResponse::from)
                .toList();
    }

    private Order lockOrder(Long orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    private void recordTransition(Order order, OrderStatus previous, Principal principal, String reason) {
        orderStatusHistoryRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .previousStatus(previous)
                .newStatus(order.getStatus())
                .changedBy(principal.userId())
                .reason(reason)
                .build());
        eventPublisher.publishEvent(new OrderStatusChangedEvent(order.getId(), order.getOrderNumber(),
                previous, order.getStatus(), principal.userId(), reason));
    }

    private static String validateReason(String reason) {
        String trimmed = reason == null ? "" : reason.trim();
        if (trimmed.length() < MIN_REASON_LENGTH || trimmed.length() > MAX_REASON_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_CANCELLATION_REASON);
        }
        return trimmed;
    }
}
