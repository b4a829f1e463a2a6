package com.imperium.lexi.model.dto.generation;

/**
 * 会话级生成结果：文本 + 实际提供服务的后端。
 */
public record GenerationResult(String text, String provider) {
}
