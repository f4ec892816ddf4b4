package com.cafepos.settings.service;

import com.cafepos.settings.dto.LoyaltyRatio;
import com.cafepos.settings.dto.TierThresholds;
import com.cafepos.settings.dto.VipThreshold;

/**
 * Typed read access to the loyalty settings. Each accessor returns a validated value,
 * falling back to the system default when the key is unset or unreadable.
 */
public interface SettingsReader {

    LoyaltyRatio getLoyaltyRatio();

    TierThresholds getTierThresholds();

    VipThreshold getVipThreshold();
}
