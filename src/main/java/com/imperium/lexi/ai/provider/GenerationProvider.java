package com.imperium.lexi.ai.provider;

import com.imperium.lexi.exception.GenerationException;
import com.imperium.lexi.model.dto.generation.GenerationRequest;

/**
 * 可互换的文本生成后端。
 * <p>
 * 实现可以在内部依次尝试多个模型变体，全部失败后才抛出 {@link GenerationException}。
 */
public interface GenerationProvider {

    /** 后端名称，用于优先级配置、会话粘性与健康检查（如 google、openai） */
    String name();

    /** 是否具备调用所需的配置（如 API key）；未配置的后端在进程生命周期内始终不可用 */
    boolean isConfigured();

    /**
     * 生成文本。
     *
     * @return 非空白的生成结果
     * @throws GenerationException 调用失败或返回内容不可用
     */
    String generate(GenerationRequest request);

    /**
     * 用最小请求探测可用性，不抛异常。
     */
    default boolean probe() {
        if (!isConfigured()) {
            return false;
        }
        try {
            String text = generate(GenerationRequest.probe());
            return text != null;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
