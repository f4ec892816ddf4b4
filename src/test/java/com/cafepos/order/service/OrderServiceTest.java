package com.cafepos.order.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.common.exception.ErrorKind;
import com.cafepos.common.security.Principal;
import com.cafepos.common.security.Role;
import com.cafepos.customer.entity.Customer;
import com.cafepos.customer.service.CustomerService;
import com.cafepos.customer.service.LoyaltyCalculator;
import com.cafepos.order.dto.CreateOrderRequest;
import com.cafepos.order.dto.OrderItemRequest;
import com.cafepos.order.dto.OrderResponse;
import com.cafepos.order.entity.Order;
import com.cafepos.order.entity.OrderStatus;
import com.cafepos.order.entity.PaymentMethod;
import com.cafepos.order.entity.PaymentStatus;
import com.cafepos.order.event.OrderCreatedEvent;
import com.cafepos.order.repository.OrderRepository;
import com.cafepos.order.repository.OrderStatusHistoryRepository;
import com.cafepos.pricing.dto.AddonBreakdown;
import com.cafepos.pricing.dto.OrderQuote;
import com.cafepos.pricing.dto.PriceBreakdown;
import com.cafepos.pricing.dto.QuotedLine;
import com.cafepos.pricing.service.OrderTotalAggregator;
import com.cafepos.settings.dto.LoyaltyRatio;
import com.cafepos.settings.service.SettingsReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final Principal MANAGER = new Principal(100L, Role.MANAGER);

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderStatusHistoryRepository orderStatusHistoryRepository;
    @Mock
    private OrderTotalAggregator orderTotalAggregator;
    @Mock
    private CustomerService customerService;
    @Spy
    private LoyaltyCalculator loyaltyCalculator = new LoyaltyCalculator();
    @Mock
    private SettingsReader settingsReader;
    @Mock
    private OrderNumberGenerator orderNumberGenerator;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private OrderService orderService;

    @Test
    @DisplayName("주문 생성 성공 - 고객 생성, 누적 금액/포인트 적립이 한 번에 처리")
    void createOrder_WithNewCustomer_UpdatesAggregates() {
        // Given
        Customer customer = customer(5L, 0);
        given(orderTotalAggregator.aggregate(anyList())).willReturn(quote("520.00"));
        given(customerService.findOrCreate("Asha Rao", "9876543210", null)).willReturn(customer);
        given(settingsReader.getLoyaltyRatio()).willReturn(LoyaltyRatio.DEFAULT);
        given(orderNumberGenerator.next(any(LocalDate.class))).willReturn("ORD-20261019-0001");
        given(orderRepository.saveAndFlush(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        OrderResponse response = orderService.createOrder(request(PaymentMethod.CASH, "9876543210"), MANAGER);

        // Then
        assertThat(response.status()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(response.orderNumber()).isEqualTo("ORD-20261019-0001");
        assertThat(response.total()).isEqualByComparingTo("520");
        assertThat(response.tax()).isEqualByComparingTo("0");
        assertThat(response.total()).isEqualTo(response.subtotal());
        assertThat(response.loyaltyPointsEarned()).isEqualTo(52);
        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(response.customerId()).isEqualTo(5L);
        assertThat(response.createdBy()).isEqualTo(100L);
        assertThat(response.items()).hasSize(1);
        assertThat(response.items().get(0).specialInstructions()).isEqualTo("less spicy");

        assertThat(customer.getTotalOrders()).isEqualTo(1);
        assertThat(customer.getTotalSpent()).isEqualByComparingTo("520");
        assertThat(customer.getLoyaltyPoints()).isEqualTo(52);

        verify(eventPublisher).publishEvent(any(OrderCreatedEvent.class));
    }

    @Test
    @DisplayName("적립 포인트: 비율 10:1, 주문 235 -> 23 포인트")
    void createOrder_CreditsFlooredPoints() {
        // Given
        Customer customer = customer(5L, 0);
        given(orderTotalAggregator.aggregate(anyList())).willReturn(quote("235.00"));
        given(customerService.findOrCreate(any(), any(), any())).willReturn(customer);
        given(settingsReader.getLoyaltyRatio()).willReturn(new LoyaltyRatio(BigDecimal.TEN, 1));
        given(orderNumberGenerator.next(any(LocalDate.class))).willReturn("ORD-20261019-0002");
        given(orderRepository.saveAndFlush(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        OrderResponse response = orderService.createOrder(request(PaymentMethod.CARD, "9876543210"), MANAGER);

        // Then
        assertThat(response.loyaltyPointsEarned()).isEqualTo(23);
        assertThat(customer.getLoyaltyPoints()).isEqualTo(23);
    }

    @Test
    @DisplayName("가격 계산 실패 시 고객/주문 어느 것도 저장되지 않음")
    void createOrder_PricingFails_NothingPersisted() {
        // Given
        given(orderTotalAggregator.aggregate(anyList()))
                .willThrow(new BusinessException(ErrorCode.INVALID_ADDON_QUANTITY));

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(request(PaymentMethod.CASH, "9876543210"), MANAGER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));

        verifyNoInteractions(customerService);
        verify(orderRepository, never()).saveAndFlush(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("포인트 결제 - 포인트 차감 후 결제 완료, 이번 주문 적립분은 별도 가산")
    void createOrder_LoyaltyPayment_DeductsPoints() {
        // Given
        Customer customer = customer(7L, 600);
        given(orderTotalAggregator.aggregate(anyList())).willReturn(quote("235.00"));
        given(customerService.getCustomerForUpdate(7L)).willReturn(customer);
        given(settingsReader.getLoyaltyRatio()).willReturn(LoyaltyRatio.DEFAULT);
        given(orderNumberGenerator.next(any(LocalDate.class))).willReturn("ORD-20261019-0003");
        given(orderRepository.saveAndFlush(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        OrderResponse response = orderService.createOrder(
                new CreateOrderRequest(List.of(line()), 7L, null, null, null, PaymentMethod.LOYALTY, null, null),
                MANAGER);

        // Then
        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(response.loyaltyPointsRedeemed()).isEqualTo(235);
        assertThat(response.loyaltyPointsEarned()).isEqualTo(23);
        assertThat(customer.getLoyaltyPoints()).isEqualTo(600 - 235 + 23);
        verify(customerService, never()).findOrCreate(any(), any(), any());
    }

    @Test
    @DisplayName("포인트 부족 시 포인트 결제 거부")
    void createOrder_LoyaltyPaymentInsufficientPoints_ThrowsException() {
        // Given
        given(orderTotalAggregator.aggregate(anyList())).willReturn(quote("235.00"));
        given(customerService.getCustomerForUpdate(7L)).willReturn(customer(7L, 100));

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(
                new CreateOrderRequest(List.of(line()), 7L, null, null, null, PaymentMethod.LOYALTY, null, null),
                MANAGER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INSUFFICIENT_LOYALTY_POINTS));
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("고객 정보 없는 포인트 결제는 거부")
    void createOrder_LoyaltyPaymentWithoutCustomer_ThrowsException() {
        // Given
        given(orderTotalAggregator.aggregate(anyList())).willReturn(quote("235.00"));

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(request(PaymentMethod.LOYALTY, null), MANAGER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.LOYALTY_CUSTOMER_REQUIRED));
    }

    @Test
    @DisplayName("전화번호/이메일 없는 방문 고객 주문은 고객 연결 없이 생성")
    void createOrder_WalkIn_NoCustomerLinked() {
        // Given
        given(orderTotalAggregator.aggregate(anyList())).willReturn(quote("180.00"));
        given(settingsReader.getLoyaltyRatio()).willReturn(LoyaltyRatio.DEFAULT);
        given(orderNumberGenerator.next(any(LocalDate.class))).willReturn("ORD-20261019-0004");
        given(orderRepository.saveAndFlush(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        OrderResponse response = orderService.createOrder(request(PaymentMethod.CASH, null), MANAGER);

        // Then
        assertThat(response.customerId()).isNull();
        assertThat(response.customerName()).isEqualTo("Asha Rao");
        assertThat(response.loyaltyPointsEarned()).isEqualTo(18);
        verifyNoInteractions(customerService);
    }

    @Test
    @DisplayName("인증 정보 없이 주문 생성 불가")
    void createOrder_WithoutPrincipal_ThrowsException() {
        assertThatThrownBy(() -> orderService.createOrder(request(PaymentMethod.CASH, null), null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.UNAUTHENTICATED));
        verifyNoInteractions(orderTotalAggregator);
    }

    @Test
    @DisplayName("취소된 주문의 결제 상태는 변경 불가")
    void updatePaymentStatus_CancelledOrder_ThrowsException() {
        // Given
        Order order = Order.builder()
                .orderNumber("ORD-20261019-0005").paymentMethod(PaymentMethod.CARD).createdBy(100L).build();
        order.requestCancellation(100L, "Customer left");
        order.approveCancellation(1L);
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        // When & Then
        assertThatThrownBy(() -> orderService.updatePaymentStatus(1L, PaymentStatus.PAID, MANAGER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.INVALID_STATE));
    }

    @Test
    @DisplayName("결제 상태 변경")
    void updatePaymentStatus_Success() {
        // Given
        Order order = Order.builder()
                .orderNumber("ORD-20261019-0006").paymentMethod(PaymentMethod.UPI).createdBy(100L).build();
        given(orderRepository.findByIdWithLock(1L)).willReturn(Optional.of(order));

        // When
        OrderResponse response = orderService.updatePaymentStatus(1L, PaymentStatus.PAID, MANAGER);

        // Then
        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PAID);
    }

    private static OrderItemRequest line() {
        return new OrderItemRequest(1L, null, null, 2, "less spicy");
    }

    private static CreateOrderRequest request(PaymentMethod paymentMethod, String phone) {
        return new CreateOrderRequest(List.of(line()), null, "Asha Rao", phone, null, paymentMethod, null, null);
    }

    private static OrderQuote quote(String total) {
        BigDecimal amount = new BigDecimal(total);
        BigDecimal unit = amount.divide(BigDecimal.valueOf(2));
        PriceBreakdown breakdown = new PriceBreakdown(1L, "Grilled Chicken Breast", null, null,
                unit, List.<AddonBreakdown>of(), unit);
        return new OrderQuote(List.of(new QuotedLine(breakdown, 2, amount)), amount, BigDecimal.ZERO, amount);
    }

    private static Customer customer(Long id, int loyaltyPoints) {
        Customer customer = Customer.builder().phone("9876543210").firstName("Asha").lastName("Rao").build();
        ReflectionTestUtils.setField(customer, "id", id);
        ReflectionTestUtils.setField(customer, "loyaltyPoints", loyaltyPoints);
        return customer;
    }
}
