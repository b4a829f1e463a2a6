package com.imperium.lexi.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.imperium.lexi.exception.GenerationException;
import com.imperium.lexi.exception.GenerationException.FailureKind;
import com.imperium.lexi.exception.ProviderNotConfiguredException;
import com.imperium.lexi.model.dto.generation.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini 生成后端：调用 generateContent REST API。
 * <p>
 * 按配置的模型列表依次尝试（如 gemini-2.5-flash → gemini-1.5-flash → gemini-pro），
 * 第一个返回可用文本的模型胜出；全部失败时抛出最后一个错误。
 */
@Component
public class GeminiGenerationProvider implements GenerationProvider {

    public static final String NAME = "google";

    private static final Logger log = LoggerFactory.getLogger(GeminiGenerationProvider.class);

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String baseUrl;
    private final List<String> models;

    public GeminiGenerationProvider(
            RestTemplate restTemplate,
            @Value("${app.ai.google.api-key:}") String apiKey,
            @Value("${app.ai.google.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${app.ai.google.models:gemini-2.5-flash,gemini-1.5-flash,gemini-pro}") List<String> models) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.models = models.stream().map(String::trim).filter(m -> !m.isEmpty()).toList();
        if (!isConfigured()) {
            log.info("Google AI not configured; provider '{}' will be skipped", NAME);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && !models.isEmpty();
    }

    @Override
    public String generate(GenerationRequest request) {
        if (!isConfigured()) {
            throw new ProviderNotConfiguredException(NAME);
        }
        GenerationException lastError = null;
        for (String model : models) {
            try {
                JsonNode body = invoke(model, buildBody(request));
                String text = extractText(body);
                if (text.isBlank()) {
                    throw new GenerationException(NAME, FailureKind.INVALID_RESPONSE,
                            "Google AI model " + model + " returned no text");
                }
                return text;
            } catch (RuntimeException e) {
                lastError = ProviderFailures.classify(NAME, model, e);
                log.warn("Google AI model {} failed ({}): {}", model, lastError.getKind(), e.getMessage());
            }
        }
        throw new GenerationException(NAME,
                lastError != null ? lastError.getKind() : FailureKind.UNKNOWN,
                "All Google AI models failed", lastError);
    }

    /**
     * 健康检查：任一模型变体能正常响应即视为可用。
     * 思考型模型在极小的 maxOutputTokens 下可能不返回文本，因此这里只看调用是否成功。
     */
    @Override
    public boolean probe() {
        if (!isConfigured()) {
            return false;
        }
        Map<String, Object> body = Map.of("contents",
                List.of(Map.of("role", "user", "parts", List.of(Map.of("text", GenerationRequest.probe().prompt())))));
        for (String model : models) {
            try {
                invoke(model, body);
                return true;
            } catch (RuntimeException e) {
                log.warn("Health check failed for Google AI model {}: {}", model, e.getMessage());
            }
        }
        return false;
    }

    private JsonNode invoke(String model, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);
        String url = baseUrl + "/models/" + model + ":generateContent";
        ResponseEntity<JsonNode> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), JsonNode.class);
        JsonNode json = response.getBody();
        if (json == null) {
            throw new GenerationException(NAME, FailureKind.INVALID_RESPONSE,
                    "Google AI model " + model + " returned an empty body");
        }
        return json;
    }

    private static Map<String, Object> buildBody(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.systemPrompt()))));
        }
        body.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", request.prompt())))));
        body.put("generationConfig", Map.of(
                "temperature", request.temperature(),
                "maxOutputTokens", request.maxTokens()));
        return body;
    }

    static String extractText(JsonNode body) {
        JsonNode parts = body.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) {
            return "";
        }
        List<String> texts = new ArrayList<>();
        for (JsonNode part : parts) {
            String text = part.path("text").asText("");
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return String.join("", texts).trim();
    }
}
