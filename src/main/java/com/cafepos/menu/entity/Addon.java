package com.cafepos.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "addons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Addon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    // e.g. "portion", "scoop", "ml"
    @Column(length = 50)
    private String unit;

    // Default per-line cap, null when unbounded
    private Integer maxQuantity;

    private boolean available;

    @Builder
    public Addon(String name, BigDecimal price, String unit, Integer maxQuantity, boolean available) {
        this.name = name;
        this.price = price;
        this.unit = unit;
        this.maxQuantity = maxQuantity;
        this.available = available;
    }
}
