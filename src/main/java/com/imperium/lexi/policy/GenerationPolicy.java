package com.imperium.lexi.policy;

/**
 * 生成调用的默认参数：调用方未指定时使用。
 */
public final class GenerationPolicy {

    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are a legal contract expert. Generate professional, legally sound contracts.";

    public static final double DEFAULT_TEMPERATURE = 0.7;

    public static final int DEFAULT_MAX_TOKENS = 4_000;

    /** 响应缓存默认 1 小时 */
    public static final long DEFAULT_CACHE_TTL_SECONDS = 3_600;

    /** 健康检查探测请求 */
    public static final String PROBE_PROMPT = "test";
    public static final int PROBE_MAX_TOKENS = 5;

    private GenerationPolicy() {}
}
