package com.cafepos.settings.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Lifetime-spend lower bounds per tier. Bronze is always 0 and the rest never decrease.
 */
public record TierThresholds(
        BigDecimal bronze,
        BigDecimal silver,
        BigDecimal gold,
        BigDecimal platinum
) {
    public static final TierThresholds DEFAULT = new TierThresholds(
            BigDecimal.ZERO, BigDecimal.valueOf(2000), BigDecimal.valueOf(5000), BigDecimal.valueOf(10000));

    public static TierThresholds from(JsonNode node) {
        BigDecimal bronze = node.has("bronze")
                ? SettingValues.nonNegativeDecimal(node, "bronze")
                : BigDecimal.ZERO;
        if (bronze.signum() != 0) {
            throw new IllegalArgumentException("bronze threshold must be 0");
        }
        BigDecimal silver = SettingValues.nonNegativeDecimal(node, "silver");
        BigDecimal gold = SettingValues.nonNegativeDecimal(node, "gold");
        BigDecimal platinum = SettingValues.nonNegativeDecimal(node, "platinum");
        if (silver.compareTo(bronze) < 0 || gold.compareTo(silver) < 0 || platinum.compareTo(gold) < 0) {
            throw new IllegalArgumentException("Tier thresholds must be in ascending order");
        }
        return new TierThresholds(bronze, silver, gold, platinum);
    }
}
