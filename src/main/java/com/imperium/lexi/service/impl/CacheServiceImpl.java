package com.imperium.lexi.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.imperium.lexi.service.CacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * 基于 Caffeine 的内存缓存。
 * <p>
 * 每个条目有自己的 TTL（set 时指定，覆盖写入时重置）；
 * 条目数超过 {@code app.cache.max-entries} 时由 Caffeine 按访问频率与最近访问淘汰。
 * 维护任务在调用线程执行，过期与淘汰结果在操作返回后立即可见。
 */
@Service
public class CacheServiceImpl implements CacheService {

    private static final Logger log = LoggerFactory.getLogger(CacheServiceImpl.class);

    /** 值 + 写入时指定的 TTL */
    private record TtlValue(Object value, long ttlNanos) {
    }

    private final Cache<String, TtlValue> cache;

    public CacheServiceImpl(Clock clock,
                            @Value("${app.cache.max-entries:10000}") int maxEntries) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .ticker(clockTicker(clock))
                .executor(Runnable::run);
        if (maxEntries > 0) {
            builder.maximumSize(maxEntries);
        }
        this.cache = builder
                .expireAfter(new Expiry<String, TtlValue>() {
                    @Override
                    public long expireAfterCreate(String key, TtlValue value, long currentTime) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, TtlValue value, long currentTime, long currentDuration) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, TtlValue value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
        log.info("In-memory cache initialized (maxEntries={})", maxEntries > 0 ? maxEntries : "unbounded");
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        if (key == null || value == null) {
            log.warn("Ignoring cache set with null key or value (key={})", key);
            return;
        }
        if (ttlSeconds <= 0) {
            log.warn("Ignoring cache set for {} with non-positive ttl {}", key, ttlSeconds);
            return;
        }
        try {
            cache.put(key, new TtlValue(value, TimeUnit.SECONDS.toNanos(ttlSeconds)));
        } catch (RuntimeException e) {
            log.error("Error caching key {}", key, e);
        }
    }

    @Override
    public Optional<Object> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            TtlValue entry = cache.getIfPresent(key);
            return entry != null ? Optional.of(entry.value()) : Optional.empty();
        } catch (RuntimeException e) {
            log.error("Error reading cache key {}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<Object> value = get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (!type.isInstance(value.get())) {
            log.warn("Cache key {} holds {} but {} was requested", key,
                    value.get().getClass().getName(), type.getName());
            return Optional.empty();
        }
        return Optional.of(type.cast(value.get()));
    }

    @Override
    public boolean delete(String key) {
        if (key == null) {
            return false;
        }
        try {
            return cache.asMap().remove(key) != null;
        } catch (RuntimeException e) {
            log.error("Error deleting cache key {}", key, e);
            return false;
        }
    }

    @Override
    public int invalidate(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return 0;
        }
        try {
            if ("*".equals(pattern)) {
                int count = size();
                cache.invalidateAll();
                log.info("Cleared {} cache entries", count);
                return count;
            }
            Pattern regex = globToRegex(pattern);
            List<String> matching = cache.asMap().keySet().stream()
                    .filter(key -> regex.matcher(key).matches())
                    .toList();
            cache.invalidateAll(matching);
            if (!matching.isEmpty()) {
                log.debug("Invalidated {} cache entries with pattern: {}", matching.size(), pattern);
            }
            return matching.size();
        } catch (RuntimeException e) {
            log.error("Error invalidating cache pattern {}", pattern, e);
            return 0;
        }
    }

    @Override
    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    @Override
    public int sweepExpired() {
        try {
            long before = cache.estimatedSize();
            cache.cleanUp();
            int cleaned = (int) Math.max(0, before - cache.estimatedSize());
            if (cleaned > 0) {
                log.debug("Cleaned up {} expired cache entries", cleaned);
            }
            return cleaned;
        } catch (RuntimeException e) {
            log.error("Error sweeping expired cache entries", e);
            return 0;
        }
    }

    /** Caffeine 的纳秒时钟取自注入的 {@link Clock}，测试可手动推进时间 */
    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        };
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(glob.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
