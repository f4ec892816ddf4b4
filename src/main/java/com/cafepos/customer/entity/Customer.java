package com.cafepos.customer.entity;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Customer with running order aggregates. The aggregates are only changed through
 * {@link #recordOrder}, {@link #redeemPoints} and {@link #reverseOrder}, always on a
 * row locked by the calling transaction.
 */
@Entity
@Table(name = "customers", uniqueConstraints = {
        @UniqueConstraint(name = "uk_customer_phone", columnNames = "phone"),
        @UniqueConstraint(name = "uk_customer_email", columnNames = "email")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 20)
    private String phone;

    private String email;

    @Column(nullable = false, length = 100)
    private String firstName;

    @Column(length = 100)
    private String lastName;

    @Column(nullable = false)
    private int totalOrders;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalSpent;

    @Column(nullable = false)
    private int loyaltyPoints;

    private boolean active;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Customer(String phone, String email, String firstName, String lastName) {
        this.phone = phone;
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.totalOrders = 0;
        this.totalSpent = BigDecimal.ZERO;
        this.loyaltyPoints = 0;
        this.active = true;
    }

    public void recordOrder(BigDecimal orderTotal, int pointsEarned) {
        this.totalOrders += 1;
        this.totalSpent = totalSpent.add(orderTotal);
        this.loyaltyPoints += pointsEarned;
    }

    public void redeemPoints(int points) {
        if (points > loyaltyPoints) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_LOYALTY_POINTS,
                    "Loyalty balance " + loyaltyPoints + " is below the required " + points);
        }
        this.loyaltyPoints -= points;
    }

    /**
     * Undoes {@link #recordOrder} and any redemption for a cancelled order. The point balance
     * may go negative if the earned points were spent in the meantime.
     */
    public void reverseOrder(BigDecimal orderTotal, int pointsEarned, int pointsRedeemed) {
        this.totalOrders -= 1;
        this.totalSpent = totalSpent.subtract(orderTotal);
        this.loyaltyPoints = loyaltyPoints - pointsEarned + pointsRedeemed;
    }

    public String getFullName() {
        return lastName == null ? firstName : firstName + " " + lastName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Customer that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
