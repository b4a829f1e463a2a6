package com.imperium.lexi.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * 条件性 OpenAI 客户端配置。
 * <p>
 * 仅当配置了 {@code app.ai.openai.api-key} 时才创建 ChatClient / EmbeddingModel，
 * 未配置时 OpenAI 后端在整个进程生命周期内视为不可用，由 fallback 链跳过，启动不会失败。
 * 重试只做一次：降级由网关在后端之间完成，不在单个后端内部反复重试。
 */
@Configuration
@ConditionalOnExpression("'${app.ai.openai.api-key:}' != ''")
public class OpenAiClientConfig {

    @Value("${app.ai.openai.api-key}")
    private String apiKey;

    @Value("${app.ai.openai.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${app.ai.openai.chat-model:gpt-4}")
    private String chatModel;

    @Value("${app.ai.openai.embedding-model:text-embedding-3-small}")
    private String embeddingModel;

    @Bean
    public OpenAiApi openAiApi() {
        return OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .build();
    }

    @Bean
    public ChatClient openAiChatClient(OpenAiApi openAiApi) {
        OpenAiChatModel model = OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(OpenAiChatOptions.builder().model(chatModel).build())
                .retryTemplate(singleAttempt())
                .build();
        return ChatClient.builder(model).build();
    }

    @Bean
    public EmbeddingModel openAiEmbeddingModel(OpenAiApi openAiApi) {
        return new OpenAiEmbeddingModel(
                openAiApi,
                MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(embeddingModel).build(),
                singleAttempt());
    }

    private static RetryTemplate singleAttempt() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }
}
