package com.cafepos.order.entity;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderTest {

    private Order order;

    @BeforeEach
    void setUp() {
        order = Order.builder()
                .orderNumber("ORD-20261019-0001")
                .paymentMethod(PaymentMethod.CARD)
                .createdBy(100L)
                .build();
    }

    @Test
    @DisplayName("새 주문은 CONFIRMED, 결제 대기 상태")
    void newOrder_IsConfirmed() {
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.isCancellationPending()).isFalse();
    }

    @Test
    @DisplayName("거절 후 다시 취소 요청 가능")
    void rejectedOrder_CanBeRequestedAgain() {
        order.requestCancellation(100L, "First reason");
        order.rejectCancellation();
        order.requestCancellation(101L, "Second reason");

        assertThat(order.isCancellationPending()).isTrue();
        assertThat(order.getCancellationRequestedBy()).isEqualTo(101L);
        assertThat(order.getCancellationReason()).isEqualTo("Second reason");
    }

    @Test
    @DisplayName("CONFIRMED 주문은 바로 취소할 수 없음")
    void confirmedOrder_CannotBeCancelledDirectly() {
        assertThatThrownBy(() -> order.approveCancellation(1L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_ORDER_STATUS));
        assertThatThrownBy(() -> order.rejectCancellation())
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("CANCELLED는 종료 상태")
    void cancelledOrder_IsTerminal() {
        order.requestCancellation(100L, "Customer left");
        order.approveCancellation(1L);

        assertThatThrownBy(() -> order.requestCancellation(100L, "Again please"))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> order.rejectCancellation())
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> order.updatePaymentStatus(PaymentStatus.PAID))
                .isInstanceOf(BusinessException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getCancelledBy()).isEqualTo(1L);
    }

    @Test
    @DisplayName("상태 전이 규칙")
    void statusTransitions() {
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.PENDING_CANCELLATION)).isTrue();
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.CANCELLED)).isFalse();
        assertThat(OrderStatus.PENDING_CANCELLATION.canTransitionTo(OrderStatus.CONFIRMED)).isTrue();
        assertThat(OrderStatus.PENDING_CANCELLATION.canTransitionTo(OrderStatus.CANCELLED)).isTrue();
        assertThat(OrderStatus.CANCELLED.canTransitionTo(OrderStatus.CONFIRMED)).isFalse();
        assertThat(OrderStatus.CANCELLED.canTransitionTo(OrderStatus.PENDING_CANCELLATION)).isFalse();
    }
}
