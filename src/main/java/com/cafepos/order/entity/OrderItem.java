package com.cafepos.order.entity;

import com.cafepos.pricing.dto.PriceBreakdown;
import com.cafepos.pricing.dto.QuotedLine;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Order line. Prices are copied from the resolved quote at creation and never
 * recomputed from the current catalog.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    @Column(nullable = false)
    private Long menuItemId;

    @Column(nullable = false)
    private String menuItemName;

    private Long variantId;

    @Column(length = 100)
    private String variantName;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Column(length = 500)
    private String specialInstructions;

    @ElementCollection
    @CollectionTable(name = "order_item_addons", joinColumns = @JoinColumn(name = "order_item_id"))
    @OrderColumn(name = "addon_index")
    private List<OrderItemAddon> addons = new ArrayList<>();

    @Builder
    public OrderItem(Long menuItemId, String menuItemName, Long variantId, String variantName,
                     int quantity, BigDecimal unitPrice, BigDecimal totalPrice,
                     String specialInstructions, List<OrderItemAddon> addons) {
        this.menuItemId = menuItemId;
        this.menuItemName = menuItemName;
        this.variantId = variantId;
        this.variantName = variantName;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.totalPrice = totalPrice;
        this.specialInstructions = specialInstructions;
        if (addons != null) {
            this.addons.addAll(addons);
        }
    }

    public static OrderItem of(QuotedLine line, String specialInstructions) {
        PriceBreakdown breakdown = line.breakdown();
        return OrderItem.builder()
                .menuItemId(breakdown.menuItemId())
                .menuItemName(breakdown.menuItemName())
                .variantId(breakdown.variantId())
                .variantName(breakdown.variantName())
                .quantity(line.quantity())
                .unitPrice(breakdown.unitPrice())
                .totalPrice(line.lineTotal())
                .specialInstructions(specialInstructions)
                .addons(breakdown.addons().stream().map(OrderItemAddon::from).toList())
                .build();
    }
}
