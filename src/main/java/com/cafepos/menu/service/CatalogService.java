package com.cafepos.menu.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.menu.dto.EffectiveAddon;
import com.cafepos.menu.dto.MenuItemResponse;
import com.cafepos.menu.dto.VariantResponse;
import com.cafepos.menu.entity.Addon;
import com.cafepos.menu.entity.CategoryAddon;
import com.cafepos.menu.entity.ItemAddonRule;
import com.cafepos.menu.entity.ItemVariant;
import com.cafepos.menu.entity.MenuItem;
import com.cafepos.menu.repository.CategoryAddonRepository;
import com.cafepos.menu.repository.ItemAddonRuleRepository;
import com.cafepos.menu.repository.ItemVariantRepository;
import com.cafepos.menu.repository.MenuItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of the menu catalog used by pricing. Nothing here mutates catalog rows.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogService {

    private final MenuItemRepository menuItemRepository;
    private final ItemVariantRepository itemVariantRepository;
    private final CategoryAddonRepository categoryAddonRepository;
    private final ItemAddonRuleRepository itemAddonRuleRepository;

    public MenuItem getMenuItem(Long menuItemId) {
        return menuItemRepository.findWithCategoryById(menuItemId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MENU_ITEM_NOT_FOUND,
                        "Menu item not found: " + menuItemId));
    }

    public Optional<ItemVariant> findVariant(Long menuItemId, Long variantId) {
        return itemVariantRepository.findByIdAndMenuItemId(variantId, menuItemId);
    }

    public MenuItemResponse getMenuItemDetail(Long menuItemId) {
        MenuItem item = getMenuItem(menuItemId);
        List<VariantResponse> variants = itemVariantRepository.findByMenuItemIdOrderByPriceAsc(menuItemId).stream()
                .map(VariantResponse::from)
                .toList();
        return MenuItemResponse.of(item, variants);
    }

    /**
     * Addons orderable with the given item: the category's active links minus item-level
     * exclusions, plus addons the item allows on its own. Unavailable addons never appear.
     */
    public List<EffectiveAddon> getEffectiveAddons(Long menuItemId) {
        MenuItem item = getMenuItem(menuItemId);
        Map<Long, ItemAddonRule> rules = itemAddonRuleRepository.findByMenuItemIdWithAddon(menuItemId).stream()
                .collect(Collectors.toMap(r -> r.getAddon().getId(), Function.identity(), (a, b) -> a, LinkedHashMap::new));

        Map<Long, EffectiveAddon> effective = new LinkedHashMap<>();
        for (CategoryAddon link : categoryAddonRepository.findActiveByCategoryId(item.getCategory().getId())) {
            Addon addon = link.getAddon();
            ItemAddonRule rule = rules.get(addon.getId());
            if (!addon.isAvailable() || (rule != null && !rule.isAllowed())) {
                continue;
            }
            effective.put(addon.getId(), toEffective(addon, link, rule));
        }
        for (ItemAddonRule rule : rules.values()) {
            Addon addon = rule.getAddon();
            if (rule.isAllowed() && addon.isAvailable() && !effective.containsKey(addon.getId())) {
                effective.put(addon.getId(), toEffective(addon, null, rule));
            }
        }
        return new ArrayList<>(effective.values());
    }

    private EffectiveAddon toEffective(Addon addon, CategoryAddon link, ItemAddonRule rule) {
        BigDecimal price = addon.getPrice();
        if (link != null && link.getPriceOverride() != null) {
            price = link.getPriceOverride();
        }
        if (rule != null && rule.getPriceOverride() != null) {
            price = rule.getPriceOverride();
        }
        Integer maxQuantity = rule != null && rule.getMaxQuantity() != null
                ? rule.getMaxQuantity()
                : addon.getMaxQuantity();
        return new EffectiveAddon(addon.getId(), addon.getName(), addon.getUnit(), price, maxQuantity);
    }
}
