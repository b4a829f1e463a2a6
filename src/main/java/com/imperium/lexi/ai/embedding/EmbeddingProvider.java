package com.imperium.lexi.ai.embedding;

import java.util.List;

/**
 * 可互换的 embedding 后端：文本 → 定长向量。
 */
public interface EmbeddingProvider {

    String name();

    boolean isConfigured();

    float[] embed(String text);

    /** 是否支持一次请求多条输入 */
    default boolean supportsBatch() {
        return false;
    }

    /**
     * 批量 embedding，返回顺序与输入一致。
     *
     * @throws UnsupportedOperationException 后端不支持批量
     */
    default List<float[]> embedBatch(List<String> texts) {
        throw new UnsupportedOperationException(name() + " does not support batch embeddings");
    }
}
