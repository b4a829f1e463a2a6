package com.imperium.lexi.service.impl;

import com.imperium.lexi.ai.provider.GenerationProvider;
import com.imperium.lexi.cache.CacheKeys;
import com.imperium.lexi.exception.GenerationException;
import com.imperium.lexi.exception.GenerationException.FailureKind;
import com.imperium.lexi.model.dto.generation.GenerationOptions;
import com.imperium.lexi.model.dto.generation.GenerationRequest;
import com.imperium.lexi.model.dto.generation.GenerationResult;
import com.imperium.lexi.policy.GenerationPolicy;
import com.imperium.lexi.service.CacheService;
import com.imperium.lexi.service.GenerationService;
import com.imperium.lexi.service.ProviderAffinityTracker;
import com.imperium.lexi.util.TextDigests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 生成网关实现。
 * <p>
 * 后端按 {@code app.ai.generation.provider-order} 排序（未列出的排在最后），
 * 瞬时错误与配置错误一视同仁：跳过当前后端、尝试下一个，区别只体现在日志级别。
 */
@Service
public class GenerationServiceImpl implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationServiceImpl.class);

    private static final String MDC_CONVERSATION_ID = "conversationId";

    private final List<GenerationProvider> providers;
    private final CacheService cacheService;
    private final ProviderAffinityTracker affinityTracker;

    public GenerationServiceImpl(List<GenerationProvider> providers,
                                 CacheService cacheService,
                                 ProviderAffinityTracker affinityTracker,
                                 @Value("${app.ai.generation.provider-order:google,openai}") List<String> providerOrder) {
        this.providers = orderProviders(providers, providerOrder);
        this.cacheService = cacheService;
        this.affinityTracker = affinityTracker;
        if (this.providers.isEmpty()) {
            throw new IllegalStateException("At least one generation provider is required");
        }
        log.info("Generation providers in priority order: {}", providerOrder());
    }

    // ==================== 公开入口 ====================

    @Override
    public String generateContent(String prompt, GenerationOptions options) {
        requirePrompt(prompt);
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();

        String cacheKey = CacheKeys.aiResponse(prompt);
        Optional<String> cached = cacheService.get(cacheKey, String.class);
        if (cached.isPresent()) {
            log.info("Using cached AI response");
            return cached.get();
        }

        GenerationRequest request = GenerationRequest.of(prompt, opts);
        GenerationException lastError = null;
        for (GenerationProvider provider : providers) {
            try {
                String response = provider.generate(request);
                long ttl = opts.getCacheTtlSeconds() != null && opts.getCacheTtlSeconds() > 0
                        ? opts.getCacheTtlSeconds()
                        : GenerationPolicy.DEFAULT_CACHE_TTL_SECONDS;
                cacheService.set(cacheKey, response, ttl);
                return response;
            } catch (RuntimeException e) {
                lastError = asGenerationException(provider, e);
                logFailover(provider, lastError, "trying next provider");
            }
        }
        throw lastError != null
                ? lastError
                : new GenerationException("none", FailureKind.UNKNOWN, "All AI providers failed");
    }

    @Override
    public GenerationResult generateForConversation(String conversationId, String prompt, GenerationOptions options) {
        requirePrompt(prompt);
        GenerationRequest request = GenerationRequest.of(prompt, options);

        String previous = MDC.get(MDC_CONVERSATION_ID);
        MDC.put(MDC_CONVERSATION_ID, conversationId != null ? conversationId : "-");
        try {
            GenerationProvider provider = affinityTracker.getProvider(conversationId)
                    .flatMap(this::findProvider)
                    .orElse(providers.get(0));

            for (int attempt = 0; ; attempt++) {
                try {
                    String text = provider.generate(request);
                    affinityTracker.remember(conversationId, provider.name());
                    return new GenerationResult(text, provider.name());
                } catch (RuntimeException e) {
                    GenerationException error = asGenerationException(provider, e);
                    if (attempt > 0 || providers.size() < 2) {
                        log.error("Generation failed on {} after failover", provider.name(), error);
                        throw error;
                    }
                    GenerationProvider alternate = alternateOf(provider);
                    logFailover(provider, error, "switching to " + alternate.name());
                    affinityTracker.remember(conversationId, alternate.name());
                    provider = alternate;
                }
            }
        } finally {
            if (previous != null) {
                MDC.put(MDC_CONVERSATION_ID, previous);
            } else {
                MDC.remove(MDC_CONVERSATION_ID);
            }
        }
    }

    @Override
    public Map<String, Boolean> healthCheck() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (GenerationProvider provider : providers) {
            boolean available;
            try {
                available = provider.probe();
            } catch (RuntimeException e) {
                log.warn("Health check for {} threw: {}", provider.name(), e.getMessage());
                available = false;
            }
            results.put(provider.name(), available);
        }
        return results;
    }

    @Override
    public List<String> providerOrder() {
        return providers.stream().map(GenerationProvider::name).toList();
    }

    // ==================== 私有方法 ====================

    private static void requirePrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required and must be a non-empty string");
        }
    }

    private Optional<GenerationProvider> findProvider(String name) {
        return providers.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /** 优先级环中的下一个后端 */
    private GenerationProvider alternateOf(GenerationProvider current) {
        int idx = providers.indexOf(current);
        return providers.get((idx + 1) % providers.size());
    }

    private static GenerationException asGenerationException(GenerationProvider provider, RuntimeException e) {
        if (e instanceof GenerationException ge) {
            return ge;
        }
        return new GenerationException(provider.name(), FailureKind.UNKNOWN,
                provider.name() + " failed: " + e.getMessage(), e);
    }

    private static void logFailover(GenerationProvider provider, GenerationException error, String next) {
        if (error.getKind() == FailureKind.CONFIGURATION) {
            log.debug("{} unavailable ({}), {}", provider.name(), error.getMessage(), next);
        } else {
            log.warn("{} failed ({}), {}: {}", provider.name(), error.getKind(), next,
                    TextDigests.preview(error.getMessage(), 220));
        }
    }

    static List<GenerationProvider> orderProviders(List<GenerationProvider> providers, List<String> order) {
        List<String> names = order != null ? order.stream().map(String::trim).toList() : List.of();
        List<GenerationProvider> sorted = new ArrayList<>(providers);
        sorted.sort(Comparator.comparingInt(p -> {
            int idx = names.indexOf(p.name());
            return idx >= 0 ? idx : Integer.MAX_VALUE;
        }));
        return List.copyOf(sorted);
    }
}
