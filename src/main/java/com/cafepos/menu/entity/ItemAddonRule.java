package com.cafepos.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Item-level addon rule. {@code allowed = false} excludes a category addon from this item;
 * {@code allowed = true} offers the addon to this item even without a category link.
 * Price and max-quantity overrides win over both category and addon defaults.
 */
@Entity
@Table(name = "item_addon_rules", uniqueConstraints = {
        @UniqueConstraint(name = "uk_item_addon_rule", columnNames = {"menu_item_id", "addon_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ItemAddonRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "menu_item_id", nullable = false)
    private MenuItem menuItem;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "addon_id", nullable = false)
    private Addon addon;

    @Column(precision = 10, scale = 2)
    private BigDecimal priceOverride;

    private boolean allowed;

    private Integer maxQuantity;

    @Builder
    public ItemAddonRule(MenuItem menuItem, Addon addon, BigDecimal priceOverride,
                         boolean allowed, Integer maxQuantity) {
        this.menuItem = menuItem;
        this.addon = addon;
        this.priceOverride = priceOverride;
        this.allowed = allowed;
        this.maxQuantity = maxQuantity;
    }
}
