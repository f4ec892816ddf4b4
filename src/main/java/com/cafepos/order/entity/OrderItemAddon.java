package com.cafepos.order.entity;

import com.cafepos.pricing.dto.AddonBreakdown;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Addon selection frozen on an order line at the price charged.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItemAddon {

    @Column(nullable = false)
    private Long addonId;

    @Column(nullable = false)
    private String addonName;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal;

    public OrderItemAddon(Long addonId, String addonName, BigDecimal unitPrice, int quantity, BigDecimal subtotal) {
        this.addonId = addonId;
        this.addonName = addonName;
        this.unitPrice = unitPrice;
        this.quantity = quantity;
        this.subtotal = subtotal;
    }

    public static OrderItemAddon from(AddonBreakdown breakdown) {
        return new OrderItemAddon(breakdown.addonId(), breakdown.name(), breakdown.unitPrice(),
                breakdown.quantity(), breakdown.subtotal());
    }
}
