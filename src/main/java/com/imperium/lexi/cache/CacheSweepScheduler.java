package com.imperium.lexi.cache;

import com.imperium.lexi.service.CacheService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理过期缓存条目，即使没有读请求也能回收内存。
 * 由应用入口的 {@code @EnableScheduling} 驱动，上下文关闭时随任务调度器一起停止。
 */
@Component
public class CacheSweepScheduler {

    private final CacheService cacheService;

    public CacheSweepScheduler(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:300000}",
            initialDelayString = "${app.cache.sweep-interval-ms:300000}")
    public void sweep() {
        cacheService.sweepExpired();
    }
}
