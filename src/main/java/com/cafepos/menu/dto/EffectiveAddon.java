package com.cafepos.menu.dto;

import java.math.BigDecimal;

/**
 * An addon as it applies to one menu item, with overrides already folded in.
 *
 * @param price       item override, else category override, else the addon's base price
 * @param maxQuantity item override, else the addon's own cap; null when unbounded
 */
public record EffectiveAddon(
        Long addonId,
        String name,
        String unit,
        BigDecimal price,
        Integer maxQuantity
) {
    public boolean allowsQuantity(int quantity) {
        return quantity >= 1 && (maxQuantity == null || quantity <= maxQuantity);
    }
}
