package com.cafepos.settings.event;

public record SettingChangedEvent(
        String key,
        Long updatedBy
) {
}
