package com.cafepos.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "item_variants", indexes = {
        @Index(name = "idx_item_variant_menu_item", columnList = "menu_item_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ItemVariant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "menu_item_id", nullable = false)
    private MenuItem menuItem;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    private boolean available;

    @Builder
    public ItemVariant(MenuItem menuItem, String name, BigDecimal price, boolean available) {
        this.menuItem = menuItem;
        this.name = name;
        this.price = price;
        this.available = available;
    }
}
