package com.imperium.lexi.ai.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.imperium.lexi.exception.EmbeddingException;
import com.imperium.lexi.util.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Google embedding 后端：embedContent REST API，逐条调用。
 * <p>
 * 请求 {@code outputDimensionality} 与部署维度一致，使两种后端的向量可以混存；
 * 截断维度后的向量不再是单位向量，因此返回前做 L2 归一化。
 */
@Component
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    public static final String NAME = "google";

    private static final Logger log = LoggerFactory.getLogger(GeminiEmbeddingProvider.class);

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int dimension;

    public GeminiEmbeddingProvider(
            RestTemplate restTemplate,
            @Value("${app.ai.google.api-key:}") String apiKey,
            @Value("${app.ai.google.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${app.ai.google.embedding-model:gemini-embedding-001}") String model,
            @Value("${app.ai.embedding.dimension:1536}") int dimension) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.dimension = dimension;
        if (!isConfigured()) {
            log.info("Google AI embeddings not configured; provider '{}' will be skipped", NAME);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public float[] embed(String text) {
        if (!isConfigured()) {
            throw new EmbeddingException("Google AI not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        Map<String, Object> body = Map.of(
                "model", "models/" + model,
                "content", Map.of("parts", List.of(Map.of("text", text))),
                "outputDimensionality", dimension);
        String url = baseUrl + "/models/" + model + ":embedContent";

        ResponseEntity<JsonNode> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), JsonNode.class);
        JsonNode values = response.getBody() != null
                ? response.getBody().path("embedding").path("values")
                : null;
        if (values == null || !values.isArray() || values.isEmpty()) {
            throw new EmbeddingException("Google AI returned no embedding values");
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) values.get(i).asDouble();
        }
        return VectorMath.normalizeVector(vector);
    }
}
