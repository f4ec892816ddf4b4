package com.cafepos.order.entity;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.customer.entity.Customer;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_order_number", columnNames = "order_number"),
        indexes = {
                @Index(name = "idx_order_customer", columnList = "customer_id"),
                @Index(name = "idx_order_status", columnList = "status"),
                @Index(name = "idx_order_status_created", columnList = "status, created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "order_number", nullable = false, length = 30)
    private String orderNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id")
    private Customer customer;

    // Denormalized for walk-ins and for the receipt
    @Column(length = 100)
    private String customerName;

    @Column(length = 20)
    private String customerPhone;

    private String customerEmail;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id")
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal tax;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private OrderStatus status;

    // Kept so a cancellation reverses exactly what was credited, whatever the ratio is by then
    @Column(nullable = false)
    private int loyaltyPointsEarned;

    @Column(nullable = false)
    private int loyaltyPointsRedeemed;

    @Column(length = 1000)
    private String notes;

    @Column(nullable = false)
    private Long createdBy;

    private Long cancellationRequestedBy;
    private LocalDateTime cancellationRequestedAt;

    @Column(length = 500)
    private String cancellationReason;

    private Long cancelledBy;
    private LocalDateTime cancelledAt;

    @CreatedDate
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Order(String orderNumber, Customer customer, String customerName, String customerPhone,
                 String customerEmail, PaymentMethod paymentMethod, PaymentStatus paymentStatus,
                 String notes, Long createdBy) {
        this.orderNumber = orderNumber;
        this.customer = customer;
        this.customerName = customerName;
        this.customerPhone = customerPhone;
        this.customerEmail = customerEmail;
        this.paymentMethod = paymentMethod;
        this.paymentStatus = paymentStatus == null ? PaymentStatus.PENDING : paymentStatus;
        this.notes = notes;
        this.createdBy = createdBy;
        this.status = OrderStatus.CONFIRMED;
        this.subtotal = BigDecimal.ZERO;
        this.tax = BigDecimal.ZERO;
        this.total = BigDecimal.ZERO;
    }

    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
    }

    public void applyTotals(BigDecimal subtotal, BigDecimal tax, BigDecimal total) {
        this.subtotal = subtotal;
        this.tax = tax;
        this.total = total;
    }

    public void applyLoyalty(int pointsEarned, int pointsRedeemed) {
        this.loyaltyPointsEarned = pointsEarned;
        this.loyaltyPointsRedeemed = pointsRedeemed;
    }

    public void updatePaymentStatus(PaymentStatus paymentStatus) {
        if (status == OrderStatus.CANCELLED) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Payment status of cancelled order " + orderNumber + " cannot change");
        }
        this.paymentStatus = paymentStatus;
    }

    public void requestCancellation(Long requestedBy, String reason) {
        transitionTo(OrderStatus.PENDING_CANCELLATION);
        this.cancellationRequestedBy = requestedBy;
        this.cancellationRequestedAt = LocalDateTime.now();
        this.cancellationReason = reason;
    }

    public void approveCancellation(Long approvedBy) {
        transitionTo(OrderStatus.CANCELLED);
        this.cancelledBy = approvedBy;
        this.cancelledAt = LocalDateTime.now();
    }

    /** Returns the order to CONFIRMED and clears the request so it can be raised again. */
    public void rejectCancellation() {
        transitionTo(OrderStatus.CONFIRMED);
        this.cancellationRequestedBy = null;
        this.cancellationRequestedAt = null;
        this.cancellationReason = null;
    }

    public boolean isCancellationPending() {
        return status == OrderStatus.PENDING_CANCELLATION;
    }

    private void transitionTo(OrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Order " + orderNumber + " is " + status + ", cannot move to " + next);
        }
        this.status = next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
