package com.imperium.lexi.service;

import java.util.Optional;

/**
 * 进程内带过期时间的键值缓存，供生成网关、上下文检索及其他调用方共享。
 * <p>
 * 缓存只是性能优化而非正确性依赖：所有方法都不会向调用方抛出异常，内部错误仅记录日志。
 */
public interface CacheService {

    /**
     * 写入并（重新）设置过期时间为 now + ttlSeconds，覆盖已有的值与 TTL。
     */
    void set(String key, Object value, long ttlSeconds);

    /**
     * 读取未过期的值；已过期的条目在此处删除（惰性淘汰）。
     */
    Optional<Object> get(String key);

    /**
     * 类型化读取，类型不匹配时视为不存在。
     */
    <T> Optional<T> get(String key, Class<T> type);

    boolean delete(String key);

    /**
     * 按通配模式删除，{@code *} 匹配任意字符序列，模式需匹配整个键；{@code "*"} 清空全部。
     *
     * @return 删除的条目数
     */
    int invalidate(String pattern);

    int size();

    /**
     * 主动清理所有已过期条目。
     *
     * @return 清理的条目数
     */
    int sweepExpired();
}
