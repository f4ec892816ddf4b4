package com.cafepos.pricing.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.menu.dto.EffectiveAddon;
import com.cafepos.menu.entity.ItemVariant;
import com.cafepos.menu.entity.MenuItem;
import com.cafepos.menu.service.CatalogService;
import com.cafepos.pricing.dto.AddonBreakdown;
import com.cafepos.pricing.dto.AddonSelection;
import com.cafepos.pricing.dto.LinePriceRequest;
import com.cafepos.pricing.dto.PriceBreakdown;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Prices a single order line against the current catalog.
 *
 * <p>Both the checkout preview and order creation go through {@link #calculateLinePrice},
 * so a quoted price is exactly what the order will be charged.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PriceResolver {

    static final int MONEY_SCALE = 2;

    private final CatalogService catalogService;

    public PriceBreakdown calculateLinePrice(LinePriceRequest request) {
        MenuItem item = catalogService.getMenuItem(request.menuItemId());
        if (!item.isAvailable()) {
            throw new BusinessException(ErrorCode.MENU_ITEM_NOT_FOUND,
                    "Menu item is not available: " + item.getName());
        }

        Long variantId = null;
        String variantName = null;
        BigDecimal basePrice;
        if (item.isVariantPriced()) {
            ItemVariant variant = resolveVariant(item, request.variantId());
            variantId = variant.getId();
            variantName = variant.getName();
            basePrice = variant.getPrice();
        } else {
            if (item.getBasePrice() == null) {
                throw new BusinessException(ErrorCode.PRICE_NOT_CONFIGURED,
                        "Menu item has no base price: " + item.getName());
            }
            basePrice = item.getBasePrice();
        }

        List<AddonBreakdown> addons = resolveAddons(item, request.addons());
        BigDecimal unitPrice = addons.stream()
                .map(AddonBreakdown::subtotal)
                .reduce(basePrice, BigDecimal::add);

        return new PriceBreakdown(item.getId(), item.getName(), variantId, variantName,
                money(basePrice), addons, money(unitPrice));
    }

    private ItemVariant resolveVariant(MenuItem item, Long variantId) {
        if (variantId == null) {
            throw new BusinessException(ErrorCode.VARIANT_REQUIRED,
                    "Variant selection is required for " + item.getName());
        }
        ItemVariant variant = catalogService.findVariant(item.getId(), variantId)
                .orElseThrow(() -> new BusinessException(ErrorCode.VARIANT_UNAVAILABLE,
                        "Variant " + variantId + " does not belong to " + item.getName()));
        if (!variant.isAvailable()) {
            throw new BusinessException(ErrorCode.VARIANT_UNAVAILABLE,
                    "Variant is not available: " + variant.getName());
        }
        return variant;
    }

    private List<AddonBreakdown> resolveAddons(MenuItem item, List<AddonSelection> selections) {
        if (selections.isEmpty()) {
            return List.of();
        }
        Map<Long, EffectiveAddon> effective = catalogService.getEffectiveAddons(item.getId()).stream()
                .collect(Collectors.toMap(EffectiveAddon::addonId, Function.identity()));

        Set<Long> seen = new HashSet<>();
        List<AddonBreakdown> breakdowns = new ArrayList<>();
        for (AddonSelection selection : selections) {
            if (!seen.add(selection.addonId())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Addon " + selection.addonId() + " selected more than once");
            }
            EffectiveAddon addon = effective.get(selection.addonId());
            if (addon == null) {
                throw new BusinessException(ErrorCode.ADDON_NOT_ALLOWED,
                        "Addon " + selection.addonId() + " is not available for " + item.getName());
            }
            int quantity = selection.quantity() == null ? 0 : selection.quantity();
            if (!addon.allowsQuantity(quantity)) {
                throw new BusinessException(ErrorCode.INVALID_ADDON_QUANTITY, addon.maxQuantity() == null
                        ? "Addon quantity must be at least 1: " + addon.name()
                        : "Addon quantity for " + addon.name() + " must be between 1 and " + addon.maxQuantity());
            }
            BigDecimal subtotal = addon.price().multiply(BigDecimal.valueOf(quantity));
            breakdowns.add(new AddonBreakdown(addon.addonId(), addon.name(), money(addon.price()),
                    quantity, money(subtotal)));
        }
        return breakdowns;
    }

    static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
