package com.imperium.lexi.service;

import com.imperium.lexi.cache.CacheKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 记录每个会话上一次成功提供服务的生成后端（会话粘性）。
 * <p>
 * 保存在共享缓存中并在每次成功后刷新 TTL；丢失只会导致重新选择默认后端，不影响正确性。
 */
@Component
public class ProviderAffinityTracker {

    private final CacheService cacheService;
    private final long ttlSeconds;

    public ProviderAffinityTracker(CacheService cacheService,
                                   @Value("${app.ai.generation.affinity-ttl-seconds:86400}") long ttlSeconds) {
        this.cacheService = cacheService;
        this.ttlSeconds = ttlSeconds;
    }

    public Optional<String> getProvider(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        return cacheService.get(CacheKeys.aiProvider(conversationId), String.class);
    }

    public void remember(String conversationId, String provider) {
        if (conversationId == null || conversationId.isBlank() || provider == null) {
            return;
        }
        cacheService.set(CacheKeys.aiProvider(conversationId), provider, ttlSeconds);
    }
}
