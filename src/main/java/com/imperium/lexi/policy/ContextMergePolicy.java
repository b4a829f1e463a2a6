package com.imperium.lexi.policy;

import java.util.Set;

/**
 * 上下文合并策略：最近消息 + 语义相似消息，按内容前缀去重。
 */
public final class ContextMergePolicy {

    /** 默认最近消息条数（保证对话连续性） */
    public static final int DEFAULT_RECENT_LIMIT = 3;

    /** 默认语义相似消息条数 */
    public static final int DEFAULT_SEMANTIC_LIMIT = 5;

    /** 默认相似度阈值 */
    public static final double DEFAULT_THRESHOLD = 0.7;

    /** 去重使用的内容前缀长度 */
    public static final int DEFAULT_DEDUP_PREFIX_CHARS = 100;

    /** 原生近邻查询取数系数（limit × 10） */
    public static final int DEFAULT_NATIVE_CANDIDATE_FACTOR = 10;

    /** 降级暴力检索候选系数（limit × 3） */
    public static final int DEFAULT_FALLBACK_CANDIDATE_FACTOR = 3;

    public static final int DEFAULT_LIMIT = 5;

    /** metadata.type 的合法取值 */
    public static final Set<String> METADATA_TYPES =
            Set.of("system", "chat", "summarize", "explain", "analyze", "suggest", "adjust");

    public static final String DEFAULT_METADATA_TYPE = "chat";

    /**
     * 去重键：内容前 prefixChars 个字符。
     */
    public static String dedupKey(String content, int prefixChars) {
        if (content == null) {
            return "";
        }
        return content.length() > prefixChars ? content.substring(0, prefixChars) : content;
    }

    private ContextMergePolicy() {}
}
