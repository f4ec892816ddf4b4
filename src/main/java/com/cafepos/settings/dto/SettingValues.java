package com.cafepos.settings.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Strict field readers for setting documents. Failures are reported as
 * {@link IllegalArgumentException} naming the offending field.
 */
final class SettingValues {

    private SettingValues() {
    }

    static BigDecimal positiveDecimal(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        if (value.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be a positive number");
        }
        return value;
    }

    static BigDecimal nonNegativeDecimal(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " must be a non-negative number");
        }
        return value;
    }

    static int positiveInt(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() <= 0) {
            throw new IllegalArgumentException(field + " must be a positive integer");
        }
        return value.intValue();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number");
        }
        return value.decimalValue();
    }
}
