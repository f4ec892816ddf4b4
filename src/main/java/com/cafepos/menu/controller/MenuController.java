package com.cafepos.menu.controller;

import com.cafepos.common.dto.ApiResponse;
import com.cafepos.menu.dto.EffectiveAddon;
import com.cafepos.menu.dto.MenuItemResponse;
import com.cafepos.menu.service.CatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/menu")
@RequiredArgsConstructor
public class MenuController {

    private final CatalogService catalogService;

    @GetMapping("/items/{id}")
    public ApiResponse<MenuItemResponse> getMenuItem(@PathVariable Long id) {
        return ApiResponse.ok(catalogService.getMenuItemDetail(id));
    }

    @GetMapping("/items/{id}/addons")
    public ApiResponse<List<EffectiveAddon>> getEffectiveAddons(@PathVariable Long id) {
        return ApiResponse.ok(catalogService.getEffectiveAddons(id));
    }
}
