package com.imperium.lexi.cache;

import com.imperium.lexi.util.TextDigests;

/**
 * 共享缓存的键前缀约定。失效时可用 {@code prefix + "*"} 作为通配模式。
 */
public final class CacheKeys {

    public static final String AI_RESPONSE_PREFIX = "ai_response:";
    public static final String AI_PROVIDER_PREFIX = "ai_provider:";
    public static final String QUERY_EMBEDDING_PREFIX = "query_embedding:";

    private CacheKeys() {
    }

    public static String aiResponse(String prompt) {
        return AI_RESPONSE_PREFIX + TextDigests.md5Hex(prompt);
    }

    public static String aiProvider(String conversationId) {
        return AI_PROVIDER_PREFIX + conversationId;
    }

    public static String queryEmbedding(String provider, String text) {
        return QUERY_EMBEDDING_PREFIX + provider + ":" + TextDigests.md5Hex(text);
    }
}
