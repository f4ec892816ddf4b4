package com.cafepos.menu.dto;

import com.cafepos.menu.entity.ItemVariant;

import java.math.BigDecimal;

public record VariantResponse(Long id, String name, BigDecimal price, boolean available) {

    public static VariantResponse from(ItemVariant variant) {
        return new VariantResponse(variant.getId(), variant.getName(), variant.getPrice(), variant.isAvailable());
    }
}
