package com.imperium.lexi.ai.provider;

import com.imperium.lexi.exception.GenerationException;
import com.imperium.lexi.exception.GenerationException.FailureKind;
import com.imperium.lexi.exception.ProviderNotConfiguredException;
import com.imperium.lexi.model.dto.generation.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * OpenAI 生成后端：通过 Spring AI ChatClient 调用 Chat Completions。
 * 未配置 API key 时 ChatClient 不存在，后端视为不可用。
 */
@Component
public class OpenAiGenerationProvider implements GenerationProvider {

    public static final String NAME = "openai";

    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationProvider.class);

    @Nullable
    private final ChatClient chatClient;

    public OpenAiGenerationProvider(@Qualifier("openAiChatClient") @Nullable ChatClient chatClient) {
        this.chatClient = chatClient;
        if (chatClient == null) {
            log.info("OpenAI not configured; provider '{}' will be skipped", NAME);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return chatClient != null;
    }

    @Override
    public String generate(GenerationRequest request) {
        if (chatClient == null) {
            throw new ProviderNotConfiguredException(NAME);
        }
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .temperature(request.temperature())
                .maxTokens(request.maxTokens());
        if (request.model() != null) {
            options.model(request.model());
        }

        String content;
        try {
            ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
            if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
                spec = spec.system(request.systemPrompt());
            }
            content = spec.user(request.prompt())
                    .options(options.build())
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw ProviderFailures.classify(NAME, request.model(), e);
        }
        if (content == null || content.isBlank()) {
            throw new GenerationException(NAME, FailureKind.INVALID_RESPONSE, "OpenAI returned no content");
        }
        return content;
    }
}
