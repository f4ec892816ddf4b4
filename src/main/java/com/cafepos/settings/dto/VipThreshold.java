package com.cafepos.settings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record VipThreshold(@JsonProperty("min_orders") int minOrders) {

    public static final VipThreshold DEFAULT = new VipThreshold(10);

    public static VipThreshold from(JsonNode node) {
        return new VipThreshold(SettingValues.positiveInt(node, "min_orders"));
    }
}
