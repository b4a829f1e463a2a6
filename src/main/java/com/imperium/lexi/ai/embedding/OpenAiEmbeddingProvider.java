package com.imperium.lexi.ai.embedding;

import com.imperium.lexi.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OpenAI embedding 后端（默认 text-embedding-3-small，1536 维），支持批量输入。
 */
@Component
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    public static final String NAME = "openai";

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    @Nullable
    private final EmbeddingModel embeddingModel;

    public OpenAiEmbeddingProvider(@Qualifier("openAiEmbeddingModel") @Nullable EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        if (embeddingModel == null) {
            log.info("OpenAI embeddings not configured; provider '{}' will be skipped", NAME);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return embeddingModel != null;
    }

    @Override
    public float[] embed(String text) {
        return requireModel().embed(text);
    }

    @Override
    public boolean supportsBatch() {
        return true;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        return requireModel().embed(texts);
    }

    private EmbeddingModel requireModel() {
        if (embeddingModel == null) {
            throw new EmbeddingException("OpenAI embeddings not configured");
        }
        return embeddingModel;
    }
}
