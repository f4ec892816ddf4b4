package com.cafepos.settings.dto;

import java.time.LocalDateTime;

/**
 * @param value     effective value, the default when {@code stored} is false
 * @param updatedAt null for defaults
 */
public record SettingResponse(
        String key,
        String description,
        Object value,
        boolean stored,
        LocalDateTime updatedAt
) {
}
