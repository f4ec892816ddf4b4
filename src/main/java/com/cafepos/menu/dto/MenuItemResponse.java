package com.cafepos.menu.dto;

import com.cafepos.menu.entity.DietType;
import com.cafepos.menu.entity.MenuItem;

import java.math.BigDecimal;
import java.util.List;

public record MenuItemResponse(
        Long id,
        Long categoryId,
        String categoryName,
        String name,
        String description,
        DietType dietType,
        BigDecimal basePrice,
        boolean variantPriced,
        boolean available,
        List<VariantResponse> variants
) {
    public static MenuItemResponse of(MenuItem item, List<VariantResponse> variants) {
        return new MenuItemResponse(
                item.getId(),
                item.getCategory().getId(),
                item.getCategory().getName(),
                item.getName(),
                item.getDescription(),
                item.getDietType(),
                item.getBasePrice(),
                item.isVariantPriced(),
                item.isAvailable(),
                variants);
    }
}
