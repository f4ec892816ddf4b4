package com.cafepos.settings.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.common.security.Principal;
import com.cafepos.common.security.Role;
import com.cafepos.settings.dto.LoyaltyRatio;
import com.cafepos.settings.dto.SettingKey;
import com.cafepos.settings.dto.SettingResponse;
import com.cafepos.settings.dto.TierThresholds;
import com.cafepos.settings.dto.VipThreshold;
import com.cafepos.settings.entity.Setting;
import com.cafepos.settings.event.SettingChangedEvent;
import com.cafepos.settings.repository.SettingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Key/value settings store backed by the {@code settings} table.
 *
 * <p>Reads go through the Caffeine {@code settings} cache. A write publishes
 * {@link SettingChangedEvent} and the cache is cleared after the write commits,
 * so a new loyalty ratio applies to the next order on this instance.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SettingsService implements SettingsReader {

    private final SettingRepository settingRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Cacheable(value = "settings", key = "'loyalty_points_ratio'")
    public LoyaltyRatio getLoyaltyRatio() {
        return read(SettingKey.LOYALTY_POINTS_RATIO, LoyaltyRatio.class);
    }

    @Override
    @Cacheable(value = "settings", key = "'tier_thresholds'")
    public TierThresholds getTierThresholds() {
        return read(SettingKey.TIER_THRESHOLDS, TierThresholds.class);
    }

    @Override
    @Cacheable(value = "settings", key = "'vip_order_threshold'")
    public VipThreshold getVipThreshold() {
        return read(SettingKey.VIP_ORDER_THRESHOLD, VipThreshold.class);
    }

    public List<SettingResponse> getAllSettings(Principal principal) {
        Principal.require(principal).requireAnyRole(Role.ADMIN);
        return Arrays.stream(SettingKey.values())
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public SettingResponse updateSetting(String key, JsonNode value, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.ADMIN);
        SettingKey settingKey = SettingKey.fromKey(key);

        Object parsed;
        try {
            parsed = settingKey.getParser().apply(value);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_SETTING_VALUE, e.getMessage());
        }

        String json = writeJson(parsed);
        Setting setting = settingRepository.findById(settingKey.getKey())
                .map(existing -> {
                    existing.update(json, principal.userId());
                    return existing;
                })
                .orElseGet(() -> Setting.builder()
                        .key(settingKey.getKey())
                        .value(json)
                        .description(settingKey.getDescription())
                        .updatedBy(principal.userId())
                        .build());
        setting = settingRepository.saveAndFlush(setting);
        eventPublisher.publishEvent(new SettingChangedEvent(settingKey.getKey(), principal.userId()));

        log.info("Setting updated: key={}, value={}, by={}", settingKey.getKey(), json, principal.userId());
        return new SettingResponse(settingKey.getKey(), settingKey.getDescription(), parsed, true, setting.getUpdatedAt());
    }

    private SettingResponse toResponse(SettingKey settingKey) {
        Optional<Setting> stored = settingRepository.findById(settingKey.getKey());
        Object value = stored.map(s -> parseOrDefault(settingKey, s.getValue()))
                .orElse(settingKey.getDefaultValue());
        return new SettingResponse(settingKey.getKey(), settingKey.getDescription(), value,
                stored.isPresent(), stored.map(Setting::getUpdatedAt).orElse(null));
    }

    private <T> T read(SettingKey settingKey, Class<T> type) {
        Object value = settingRepository.findById(settingKey.getKey())
                .map(s -> parseOrDefault(settingKey, s.getValue()))
                .orElse(settingKey.getDefaultValue());
        return type.cast(value);
    }

    // Corrupt rows fall back to the default
    private Object parseOrDefault(SettingKey settingKey, String json) {
        try {
            return settingKey.getParser().apply(objectMapper.readTree(json));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable setting {}, using default: {}", settingKey.getKey(), e.getMessage());
            return settingKey.getDefaultValue();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_SETTING_VALUE, e.getOriginalMessage());
        }
    }
}
