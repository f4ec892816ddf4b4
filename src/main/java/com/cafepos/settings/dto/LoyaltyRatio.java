package com.cafepos.settings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Every {@code spendAmount} of order total earns {@code pointsEarned} loyalty points.
 */
public record LoyaltyRatio(
        @JsonProperty("spend_amount") BigDecimal spendAmount,
        @JsonProperty("points_earned") int pointsEarned
) {
    public static final LoyaltyRatio DEFAULT = new LoyaltyRatio(BigDecimal.TEN, 1);
    public static final int MAX_POINTS_EARNED = 1000;

    public static LoyaltyRatio from(JsonNode node) {
        BigDecimal spendAmount = SettingValues.positiveDecimal(node, "spend_amount");
        int pointsEarned = SettingValues.positiveInt(node, "points_earned");
        if (pointsEarned > MAX_POINTS_EARNED) {
            throw new IllegalArgumentException("points_earned must not exceed " + MAX_POINTS_EARNED);
        }
        return new LoyaltyRatio(spendAmount, pointsEarned);
    }
}
