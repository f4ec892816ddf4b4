package com.cafepos.settings.controller;

import com.cafepos.common.dto.ApiResponse;
import com.cafepos.common.security.CurrentPrincipal;
import com.cafepos.common.security.Principal;
import com.cafepos.settings.dto.SettingResponse;
import com.cafepos.settings.service.SettingsService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public ApiResponse<List<SettingResponse>> getSettings(@CurrentPrincipal Principal principal) {
        return ApiResponse.ok(settingsService.getAllSettings(principal));
    }

    @PutMapping("/{key}")
    public ApiResponse<SettingResponse> updateSetting(@PathVariable String key,
                                                      @RequestBody JsonNode value,
                                                      @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(settingsService.updateSetting(key, value, principal));
    }
}
