package com.imperium.lexi.model.dto.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * generateContent 的可选参数，未设置的字段使用 GenerationPolicy 中的默认值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationOptions {

    /** 系统指令 */
    private String systemPrompt;

    /** 采样温度 */
    private Double temperature;

    /** 最大输出 token 数 */
    private Integer maxTokens;

    /** 响应缓存时长（秒） */
    private Long cacheTtlSeconds;

    /** 模型覆盖，仅 OpenAI 兼容后端使用；Gemini 按自身的模型列表依次尝试 */
    private String model;

    public static GenerationOptions defaults() {
        return new GenerationOptions();
    }
}
