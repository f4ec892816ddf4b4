package com.cafepos.order.dto;

import com.cafepos.order.entity.OrderItem;
import com.cafepos.pricing.dto.AddonBreakdown;

import java.math.BigDecimal;
import java.util.List;

public record OrderItemResponse(
        Long id,
        Long menuItemId,
        String menuItemName,
        Long variantId,
        String variantName,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal totalPrice,
        String specialInstructions,
        List<AddonBreakdown> addons
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getId(),
                item.getMenuItemId(),
                item.getMenuItemName(),
                item.getVariantId(),
                item.getVariantName(),
                item.getQuantity(),
                item.getUnitPrice(),
                item.getTotalPrice(),
                item.getSpecialInstructions(),
                item.getAddons().stream()
                        .map(a -> new AddonBreakdown(a.getAddonId(), a.getAddonName(), a.getUnitPrice(),
                                a.getQuantity(), a.getSubtotal()))
                        .toList());
    }
}
