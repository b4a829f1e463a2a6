package com.imperium.lexi.service;

import com.imperium.lexi.model.dto.generation.GenerationOptions;
import com.imperium.lexi.model.dto.generation.GenerationResult;

import java.util.List;
import java.util.Map;

/**
 * 生成网关：在多个可互换的生成后端之间按优先级降级，并缓存响应。
 */
public interface GenerationService {

    /**
     * 生成文本。命中缓存时直接返回、不调用任何后端；否则按优先级依次尝试后端，
     * 第一个成功的结果写入缓存并返回。
     *
     * @throws IllegalArgumentException prompt 为空
     * @throws com.imperium.lexi.exception.GenerationException 所有后端都失败（最后一个错误）
     */
    String generateContent(String prompt, GenerationOptions options);

    /**
     * 会话级生成：优先使用该会话上次成功的后端，失败时切换到备用后端并重试一次。
     * 不读写响应缓存。
     *
     * @param conversationId 会话 ID，可为 null（此时不记录粘性）
     */
    GenerationResult generateForConversation(String conversationId, String prompt, GenerationOptions options);

    /**
     * 探测每个后端的可用性，按优先级顺序返回，不抛异常。
     */
    Map<String, Boolean> healthCheck();

    /** 优先级顺序中的后端名称 */
    List<String> providerOrder();
}
