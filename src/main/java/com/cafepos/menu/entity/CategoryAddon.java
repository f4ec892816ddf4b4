package com.cafepos.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Offers an addon to every item of a category, optionally at a category-specific price.
 */
@Entity
@Table(name = "category_addons", uniqueConstraints = {
        @UniqueConstraint(name = "uk_category_addon", columnNames = {"category_id", "addon_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CategoryAddon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "addon_id", nullable = false)
    private Addon addon;

    @Column(precision = 10, scale = 2)
    private BigDecimal priceOverride;

    private boolean active;

    @Builder
    public CategoryAddon(Category category, Addon addon, BigDecimal priceOverride, boolean active) {
        this.category = category;
        this.addon = addon;
        this.priceOverride = priceOverride;
        this.active = active;
    }
}
