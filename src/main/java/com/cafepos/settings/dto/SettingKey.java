package com.cafepos.settings.dto;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.function.Function;

@Getter
@RequiredArgsConstructor
public enum SettingKey {

    LOYALTY_POINTS_RATIO("loyalty_points_ratio", "Points earned per amount spent", LoyaltyRatio::from, LoyaltyRatio.DEFAULT),
    TIER_THRESHOLDS("tier_thresholds", "Lifetime spend required per customer tier", TierThresholds::from, TierThresholds.DEFAULT),
    VIP_ORDER_THRESHOLD("vip_order_threshold", "Order count that marks a customer as VIP", VipThreshold::from, VipThreshold.DEFAULT);

    private final String key;
    private final String description;
    private final Function<JsonNode, Object> parser;
    private final Object defaultValue;

    public static SettingKey fromKey(String key) {
        return Arrays.stream(values())
                .filter(k -> k.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.UNKNOWN_SETTING, "Unknown setting key: " + key));
    }
}
