package com.imperium.lexi.config;

import com.imperium.lexi.policy.ContextMergePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 语义上下文检索参数（app.context.*）。
 */
@Data
@ConfigurationProperties(prefix = "app.context")
public class ContextRetrievalProperties {

    /** 是否使用 pgvector 原生近邻查询；关闭时直接走进程内暴力相似度 */
    private boolean nativeSearchEnabled = true;

    /** 原生查询的取数上限 = limit × 该系数 */
    private int nativeCandidateFactor = ContextMergePolicy.DEFAULT_NATIVE_CANDIDATE_FACTOR;

    /** 降级路径的候选数 = limit × 该系数 */
    private int fallbackCandidateFactor = ContextMergePolicy.DEFAULT_FALLBACK_CANDIDATE_FACTOR;

    private int defaultLimit = ContextMergePolicy.DEFAULT_LIMIT;

    private double defaultThreshold = ContextMergePolicy.DEFAULT_THRESHOLD;

    private int recentLimit = ContextMergePolicy.DEFAULT_RECENT_LIMIT;

    private int semanticLimit = ContextMergePolicy.DEFAULT_SEMANTIC_LIMIT;

    /** 去重键：内容前 N 个字符 */
    private int dedupPrefixChars = ContextMergePolicy.DEFAULT_DEDUP_PREFIX_CHARS;

    /** 查询向量缓存秒数，0 表示不缓存 */
    private long queryEmbeddingCacheTtl = 300;

    private int writeThreads = 8;

    private int writeQueueCapacity = 1000;
}
