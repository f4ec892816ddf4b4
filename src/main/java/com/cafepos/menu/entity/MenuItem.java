package com.cafepos.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Sellable item. Priced either by a flat {@code basePrice} or, when {@code variantPriced}
 * is set, by exactly one of its {@link ItemVariant}s.
 */
@Entity
@Table(name = "menu_items", indexes = {
        @Index(name = "idx_menu_item_category", columnList = "category_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @Column(nullable = false)
    private String name;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DietType dietType;

    // Null for variant-priced items
    @Column(precision = 10, scale = 2)
    private BigDecimal basePrice;

    private boolean variantPriced;

    private boolean available;

    @Builder
    public MenuItem(Category category, String name, String description, DietType dietType,
                    BigDecimal basePrice, boolean variantPriced, boolean available) {
        this.category = category;
        this.name = name;
        this.description = description;
        this.dietType = dietType == null ? DietType.VEG : dietType;
        this.basePrice = basePrice;
        this.variantPriced = variantPriced;
        this.available = available;
    }
}
