package com.cafepos.order.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.common.security.Principal;
import com.cafepos.common.security.Role;
import com.cafepos.customer.entity.Customer;
import com.cafepos.customer.service.CustomerService;
import com.cafepos.customer.service.LoyaltyCalculator;
import com.cafepos.order.dto.CreateOrderRequest;
import com.cafepos.order.dto.OrderItemRequest;
import com.cafepos.order.dto.OrderResponse;
import com.cafepos.order.dto.OrderStatusHistoryResponse;
import com.cafepos.order.dto.OrderSummaryResponse;
import com.cafepos.order.entity.Order;
import com.cafepos.order.entity.OrderItem;
import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.entity.PaymentMethod;
import com.cafepos.order.entity.PaymentStatus;
import com.cafepos.order.event.OrderCreatedEvent;
import com.cafepos.order.repository.OrderRepository;
import com.cafepos.order.repository.OrderStatusHistoryRepository;
import com.cafepos.pricing.dto.OrderQuote;
import com.cafepos.pricing.service.OrderTotalAggregator;
import com.cafepos.settings.service.SettingsReader;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.List;

/**
 * Order capture: prices the lines, links the customer, settles loyalty and persists
 * the order, all in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository orderStatusHistoryRepository;
    private final OrderTotalAggregator orderTotalAggregator;
    private final CustomerService customerService;
    private final LoyaltyCalculator loyaltyCalculator;
    private final SettingsReader settingsReader;
    private final OrderNumberGenerator orderNumberGenerator;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a CONFIRMED order.
     *
     * <ol>
     *   <li>Price every line. Nothing is written if any line is rejected.</li>
     *   <li>Link the customer: by id, or find-or-create by phone/email.</li>
     *   <li>Settle a LOYALTY payment from the customer's points.</li>
     *   <li>Persist order and lines with the quoted prices.</li>
     *   <li>Credit earned points and update the customer's aggregates.</li>
     * </ol>
     *
     * <p>@Retry wraps @Transactional, so each attempt runs in a fresh transaction.
     * A unique-constraint collision (customer phone/email or order number) rolls the
     * attempt back and the next attempt re-reads the row that won.</p>
     */
    @Transactional
    @Retry(name = "orderCreation", fallbackMethod = "createOrderFallback")
    public OrderResponse createOrder(CreateOrderRequest request, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        log.info("Creating order: items={}, paymentMethod={}, by={}",
                request.items().size(), request.paymentMethod(), principal.userId());

        OrderQuote quote = orderTotalAggregator.aggregate(request.items().stream()
                .map(OrderItemRequest::toLinePriceRequest)
                .toList());

        Customer customer = resolveCustomer(request);

        PaymentStatus paymentStatus = request.paymentStatus() == null
                ? PaymentStatus.PENDING
                : request.paymentStatus();
        int pointsRedeemed = 0;
        if (request.paymentMethod() == PaymentMethod.LOYALTY) {
            if (customer == null) {
                throw new BusinessException(ErrorCode.LOYALTY_CUSTOMER_REQUIRED);
            }
            pointsRedeemed = loyaltyCalculator.pointsToRedeem(quote.total());
            customer.redeemPoints(pointsRedeemed);
            paymentStatus = PaymentStatus.PAID;
        }

        Order order = Order.builder()
                .orderNumber(orderNumberGenerator.next(LocalDate.now()))
                .customer(customer)
                .customerName(firstText(request.customerName(), customer == null ? null : customer.getFullName()))
                .customerPhone(firstText(request.customerPhone(), customer == null ? null : customer.getPhone()))
                .customerEmail(firstText(request.customerEmail(), customer == null ? null : customer.getEmail()))
                .paymentMethod(request.paymentMethod())
                .paymentStatus(paymentStatus)
                .notes(request.notes())
                .createdBy(principal.userId())
                .build();
        for (int i = 0; i < quote.lines().size(); i++) {
            order.addItem(OrderItem.of(quote.lines().get(i), request.items().get(i).specialInstructions()));
        }
        order.applyTotals(quote.subtotal(), quote.tax(), quote.total());

        int pointsEarned = loyaltyCalculator.pointsEarned(quote.total(), settingsReader.getLoyaltyRatio());
        order.applyLoyalty(pointsEarned, pointsRedeemed);
        if (customer != null) {
            customer.recordOrder(quote.total(), pointsEarned);
        }

        order = orderRepository.saveAndFlush(order);

        eventPublisher.publishEvent(new OrderCreatedEvent(order.getId(), order.getOrderNumber(), order.getTotal(),
                customer == null ? null : customer.getId(), pointsEarned, principal.userId()));
        log.info("Order created: orderNumber={}, total={}, customerId={}, pointsEarned={}",
                order.getOrderNumber(), order.getTotal(), customer == null ? null : customer.getId(), pointsEarned);
        return OrderResponse.from(order);
    }

    public OrderResponse getOrder(Long orderId, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        return OrderResponse.from(findOrder(orderId));
    }

    public Page<OrderSummaryResponse> getOrders(OrderStatus status, Pageable pageable, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        Page<Order> orders = status == null
                ? orderRepository.findAll(pageable)
                : orderRepository.findByStatus(status, pageable);
        return orders.map(OrderSummaryResponse::from);
    }

    public List<OrderStatusHistoryResponse> getStatusHistory(Long orderId, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        if (!orderRepository.existsById(orderId)) {
            throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
        }
        return orderStatusHistoryRepository.findByOrderIdOrderByIdAsc(orderId).stream()
                .map(OrderStatusHistoryResponse::from)
                .toList();
    }

    @Transactional
    public OrderResponse updatePaymentStatus(Long orderId, PaymentStatus paymentStatus, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (order.getPaymentMethod() == PaymentMethod.LOYALTY) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Loyalty payments are settled when the order is created");
        }
        order.updatePaymentStatus(paymentStatus);
        log.info("Payment status updated: orderNumber={}, paymentStatus={}, by={}",
                order.getOrderNumber(), paymentStatus, principal.userId());
        return OrderResponse.from(order);
    }

    private Order findOrder(Long orderId) {
        return orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    private Customer resolveCustomer(CreateOrderRequest request) {
        if (request.customerId() != null) {
            return customerService.getCustomerForUpdate(request.customerId());
        }
        if (StringUtils.hasText(request.customerPhone()) || StringUtils.hasText(request.customerEmail())) {
            return customerService.findOrCreate(request.customerName(), request.customerPhone(),
                    request.customerEmail());
        }
        return null;
    }

    private static String firstText(String preferred, String fallback) {
        return StringUtils.hasText(preferred) ? preferred.trim() : fallback;
    }

    @SuppressWarnings("unused")
    private OrderResponse createOrderFallback(CreateOrderRequest request, Principal principal,
                                              DataIntegrityViolationException e) {
        log.warn("Order creation kept colliding, giving up: {}", e.getMostSpecificCause().getMessage());
        throw new BusinessException(ErrorCode.DATA_CONFLICT,
                "Order could not be created due to a concurrent update, please retry");
    }
}
