package com.cafepos.menu.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "categories")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Category {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    private String description;

    private boolean active;

    @Builder
    public Category(String name, String description, boolean active) {
        this.name = name;
        this.description = description;
        this.active = active;
    }
}
