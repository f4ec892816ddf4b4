package com.cafepos.settings.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Clears the {@code settings} cache once a settings change has committed. Evicting any
 * earlier lets a concurrent reader cache the old value again until the entry expires.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettingsCacheEvictor {

    static final String CACHE_NAME = "settings";

    private final CacheManager cacheManager;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSettingChanged(SettingChangedEvent event) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache != null) {
            cache.clear();
        }
        log.info("Settings cache cleared after update: key={}, by={}", event.key(), event.updatedBy());
    }
}
