package com.imperium.lexi.model.dto.generation;

import com.imperium.lexi.policy.GenerationPolicy;

/**
 * 发给单个生成后端的请求（不持久化）。
 */
public record GenerationRequest(String prompt,
                                String systemPrompt,
                                double temperature,
                                int maxTokens,
                                String model) {

    public static GenerationRequest of(String prompt, GenerationOptions options) {
        GenerationOptions o = options != null ? options : GenerationOptions.defaults();
        String system = (o.getSystemPrompt() != null && !o.getSystemPrompt().isBlank())
                ? o.getSystemPrompt()
                : GenerationPolicy.DEFAULT_SYSTEM_PROMPT;
        double temperature = o.getTemperature() != null ? o.getTemperature() : GenerationPolicy.DEFAULT_TEMPERATURE;
        int maxTokens = (o.getMaxTokens() != null && o.getMaxTokens() > 0)
                ? o.getMaxTokens()
                : GenerationPolicy.DEFAULT_MAX_TOKENS;
        String model = (o.getModel() != null && !o.getModel().isBlank()) ? o.getModel().trim() : null;
        return new GenerationRequest(prompt, system, temperature, maxTokens, model);
    }

    /** 健康检查用的最小请求 */
    public static GenerationRequest probe() {
        return new GenerationRequest(GenerationPolicy.PROBE_PROMPT, null,
                GenerationPolicy.DEFAULT_TEMPERATURE, GenerationPolicy.PROBE_MAX_TOKENS, null);
    }
}
