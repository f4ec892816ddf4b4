package com.cafepos.menu.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.menu.dto.EffectiveAddon;
import com.cafepos.menu.entity.Addon;
import com.cafepos.menu.entity.Category;
import com.cafepos.menu.entity.CategoryAddon;
import com.cafepos.menu.entity.DietType;
import com.cafepos.menu.entity.ItemAddonRule;
import com.cafepos.menu.entity.MenuItem;
import com.cafepos.menu.repository.CategoryAddonRepository;
import com.cafepos.menu.repository.ItemAddonRuleRepository;
import com.cafepos.menu.repository.ItemVariantRepository;
import com.cafepos.menu.repository.MenuItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class CatalogServiceTest {

    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private ItemVariantRepository itemVariantRepository;
    @Mock
    private CategoryAddonRepository categoryAddonRepository;
    @Mock
    private ItemAddonRuleRepository itemAddonRuleRepository;

    @InjectMocks
    private CatalogService catalogService;

    private Category mains;
    private MenuItem chicken;

    @BeforeEach
    void setUp() {
        mains = Category.builder().name("Mains").active(true).build();
        ReflectionTestUtils.setField(mains, "id", 10L);
        chicken = MenuItem.builder()
                .category(mains)
                .name("Grilled Chicken Breast")
                .dietType(DietType.NON_VEG)
                .basePrice(new BigDecimal("180.00"))
                .available(true)
                .build();
        ReflectionTestUtils.setField(chicken, "id", 1L);
    }

    @Test
    @DisplayName("카테고리 연결 addon + 아이템 허용 addon - 아이템 제외 addon, 판매중지 addon")
    void getEffectiveAddons_ComposesCategoryLinksAndItemRules() {
        // Given
        Addon cheese = addon(21L, "Extra Cheese", "40.00", 3, true);
        Addon sauce = addon(22L, "Peri Peri Sauce", "25.00", null, true);
        Addon egg = addon(23L, "Fried Egg", "30.00", 2, true);
        Addon truffle = addon(24L, "Truffle Oil", "90.00", 1, false);
        Addon avocado = addon(25L, "Avocado", "60.00", 2, true);

        given(menuItemRepository.findWithCategoryById(1L)).willReturn(Optional.of(chicken));
        given(categoryAddonRepository.findActiveByCategoryId(10L)).willReturn(List.of(
                link(cheese, null),
                link(sauce, new BigDecimal("20.00")),
                link(egg, null),
                link(truffle, null)));
        given(itemAddonRuleRepository.findByMenuItemIdWithAddon(1L)).willReturn(List.of(
                rule(egg, null, false, null),
                rule(cheese, new BigDecimal("35.00"), true, 5),
                rule(avocado, null, true, null)));

        // When
        List<EffectiveAddon> addons = catalogService.getEffectiveAddons(1L);

        // Then
        assertThat(addons)
                .extracting(EffectiveAddon::addonId, EffectiveAddon::price, EffectiveAddon::maxQuantity)
                .containsExactly(
                        tuple(21L, new BigDecimal("35.00"), 5),
                        tuple(22L, new BigDecimal("20.00"), null),
                        tuple(25L, new BigDecimal("60.00"), 2));
    }

    @Test
    @DisplayName("아이템 규칙이 카테고리 가격 재정의보다 우선")
    void getEffectiveAddons_ItemOverrideBeatsCategoryOverride() {
        // Given
        Addon cheese = addon(21L, "Extra Cheese", "40.00", 3, true);
        given(menuItemRepository.findWithCategoryById(1L)).willReturn(Optional.of(chicken));
        given(categoryAddonRepository.findActiveByCategoryId(10L))
                .willReturn(List.of(link(cheese, new BigDecimal("30.00"))));
        given(itemAddonRuleRepository.findByMenuItemIdWithAddon(1L))
                .willReturn(List.of(rule(cheese, new BigDecimal("25.00"), true, null)));

        // When
        List<EffectiveAddon> addons = catalogService.getEffectiveAddons(1L);

        // Then
        assertThat(addons).singleElement().satisfies(a -> {
            assertThat(a.price()).isEqualByComparingTo("25.00");
            assertThat(a.maxQuantity()).isEqualTo(3);
            assertThat(a.allowsQuantity(3)).isTrue();
            assertThat(a.allowsQuantity(4)).isFalse();
        });
    }

    @Test
    @DisplayName("존재하지 않는 메뉴")
    void getMenuItem_NotFound_ThrowsException() {
        given(menuItemRepository.findWithCategoryById(99L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> catalogService.getEffectiveAddons(99L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.MENU_ITEM_NOT_FOUND));
    }

    private CategoryAddon link(Addon addon, BigDecimal priceOverride) {
        return CategoryAddon.builder().category(mains).addon(addon).priceOverride(priceOverride).active(true).build();
    }

    private ItemAddonRule rule(Addon addon, BigDecimal priceOverride, boolean allowed, Integer maxQuantity) {
        return ItemAddonRule.builder()
                .menuItem(chicken).addon(addon).priceOverride(priceOverride)
                .allowed(allowed).maxQuantity(maxQuantity)
                .build();
    }

    private static Addon addon(Long id, String name, String price, Integer maxQuantity, boolean available) {
        Addon addon = Addon.builder()
                .name(name).price(new BigDecimal(price)).unit("portion")
                .maxQuantity(maxQuantity).available(available)
                .build();
        ReflectionTestUtils.setField(addon, "id", id);
        return addon;
    }
}
