package com.imperium.lexi.service;

import com.imperium.lexi.util.VectorMath;

import java.util.List;

/**
 * Embedding 生成：首选后端失败时切换到备用后端，不做缓存（调用方负责持久化）。
 */
public interface EmbeddingService {

    /**
     * 带后端信息的 embedding 结果。
     */
    record EmbeddingResult(float[] vector, String provider) {
    }

    /** 使用默认后端 */
    float[] generateEmbedding(String text);

    /**
     * @param preferredProvider 首选后端名称，未知或为 null 时使用默认后端
     * @throws IllegalArgumentException 文本为空
     * @throws com.imperium.lexi.exception.EmbeddingException 所有后端都失败
     */
    float[] generateEmbedding(String text, String preferredProvider);

    /** 同 {@link #generateEmbedding(String, String)}，同时返回实际使用的后端 */
    EmbeddingResult embed(String text, String preferredProvider);

    /**
     * 批量生成：后端支持时一次请求多条输入，否则（或批量调用失败时）逐条生成。
     */
    List<float[]> generateEmbeddingsBatch(List<String> texts, String provider);

    /** 部署统一的向量维度 */
    int getDimension();

    String getDefaultProvider();

    default double cosineSimilarity(float[] a, float[] b) {
        return VectorMath.cosineSimilarity(a, b);
    }

    default float[] normalizeVector(float[] v) {
        return VectorMath.normalizeVector(v);
    }
}
